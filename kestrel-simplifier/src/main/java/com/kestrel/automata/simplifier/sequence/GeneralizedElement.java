package com.kestrel.automata.simplifier.sequence;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;

import java.util.Objects;

/**
 * One position of a generalized sequence: either a single (soft) symbol or a
 * weighted self-loop.
 *
 * <p>A self-loop element carries a loop weight and may have no distribution, in
 * which case it stands for an epsilon self-loop. A plain symbol must have a
 * distribution.
 *
 * @param <E> Element type
 * @param <D> Element distribution type
 */
public final class GeneralizedElement<E, D extends ElementDistribution<E, D>> {

    private final D elementDistribution;
    private final int group;
    private final Weight loopWeight;

    /**
     * @param elementDistribution Distribution of the symbol, {@code null} only for epsilon self-loops
     * @param group Group tag of the originating transition
     * @param loopWeight Weight of the self-loop, {@code null} for a plain symbol
     */
    public GeneralizedElement(D elementDistribution, int group, Weight loopWeight) {
        if (elementDistribution == null && loopWeight == null) {
            throw new IllegalArgumentException("Epsilon elements are only allowed in combination with self-loops");
        }
        this.elementDistribution = elementDistribution;
        this.group = group;
        this.loopWeight = loopWeight;
    }

    public static <E, D extends ElementDistribution<E, D>> GeneralizedElement<E, D> symbol(
            D elementDistribution, int group) {
        return new GeneralizedElement<>(Objects.requireNonNull(elementDistribution), group, null);
    }

    public static <E, D extends ElementDistribution<E, D>> GeneralizedElement<E, D> selfLoop(
            D elementDistribution, int group, Weight loopWeight) {
        return new GeneralizedElement<>(elementDistribution, group, Objects.requireNonNull(loopWeight));
    }

    public D getElementDistribution() {
        return elementDistribution;
    }

    public int getGroup() {
        return group;
    }

    public Weight getLoopWeight() {
        return loopWeight;
    }

    public boolean isSelfLoop() {
        return loopWeight != null;
    }

    public boolean isEpsilonSelfLoop() {
        return elementDistribution == null && loopWeight != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeneralizedElement)) return false;
        GeneralizedElement<?, ?> that = (GeneralizedElement<?, ?>) o;
        return group == that.group
                && Objects.equals(elementDistribution, that.elementDistribution)
                && Objects.equals(loopWeight, that.loopWeight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementDistribution, group, loopWeight);
    }

    @Override
    public String toString() {
        String symbol;
        if (elementDistribution == null) {
            symbol = "eps";
        } else if (elementDistribution.isPointMass()) {
            symbol = String.valueOf(elementDistribution.getPoint());
        } else {
            symbol = elementDistribution.toString();
        }
        String groupPrefix = group == 0 ? "" : "#" + group;
        return loopWeight == null ? groupPrefix + symbol : groupPrefix + symbol + "*(" + loopWeight + ")";
    }
}
