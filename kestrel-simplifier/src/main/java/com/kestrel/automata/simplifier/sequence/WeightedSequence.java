package com.kestrel.automata.simplifier.sequence;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;

import java.util.Objects;

/**
 * A generalized sequence together with the total weight the automaton assigns to it.
 */
public record WeightedSequence<E, D extends ElementDistribution<E, D>>(
        GeneralizedSequence<E, D> sequence, Weight weight) {

    public WeightedSequence {
        Objects.requireNonNull(sequence, "sequence cannot be null");
        Objects.requireNonNull(weight, "weight cannot be null");
    }

    @Override
    public String toString() {
        return "[" + sequence + "," + weight + "]";
    }
}
