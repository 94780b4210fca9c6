package com.kestrel.automata.core.model;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.core.evaluation.AutomatonAnalysis;
import com.kestrel.automata.core.evaluation.EpsilonClosure;
import com.kestrel.automata.core.evaluation.SequenceEvaluator;

/**
 * Read-only view of a single state of an {@link Automaton}.
 *
 * <p>A view holds only its owner and index; creating one is free and nothing is
 * copied. Two views are equal when they refer to the same index of the same
 * automaton instance.
 */
public final class State<S, E, D extends ElementDistribution<E, D>> {
    private static final String START_STATE_MARKER = "START ->";
    private static final String TRANSITION_SEPARATOR = ",";

    private final Automaton<S, E, D> owner;
    private final int index;

    State(Automaton<S, E, D> owner, int index) {
        this.owner = owner;
        this.index = index;
    }

    public Automaton<S, E, D> getOwner() {
        return owner;
    }

    public int getIndex() {
        return index;
    }

    public Weight getEndWeight() {
        return owner.stateData(index).endWeight();
    }

    public boolean canEnd() {
        return owner.stateData(index).canEnd();
    }

    public boolean isStart() {
        return owner.getStartStateIndex() == index;
    }

    public TransitionList<D> getTransitions() {
        StateData data = owner.stateData(index);
        return new TransitionList<>(owner.transitionArray(), data.firstTransitionIndex(), data.lastTransitionIndex());
    }

    public EpsilonClosure<S, E, D> getEpsilonClosure() {
        return owner.getEpsilonClosure(index);
    }

    /**
     * Computes the logarithm of the value of the automaton started at this state on {@code sequence}.
     */
    public double getLogValue(S sequence) {
        return SequenceEvaluator.getLogValue(owner, index, sequence);
    }

    /**
     * Whether the automaton started at this state is zero on every sequence.
     */
    public boolean isZero() {
        return AutomatonAnalysis.isZero(owner, index);
    }

    public boolean hasNonTrivialLoops() {
        return AutomatonAnalysis.hasNonTrivialLoops(owner, index);
    }

    /**
     * Whether any transition of the owning automaton, self-loops included, leads to this state.
     */
    public boolean hasIncomingTransitions() {
        for (Transition<D> transition : owner.transitionArray()) {
            if (transition.destinationStateIndex() == index) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof State)) return false;
        State<?, ?, ?> that = (State<?, ?, ?>) o;
        return owner == that.owner && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isStart()) {
            sb.append(START_STATE_MARKER);
        }

        boolean firstTransition = true;
        for (Transition<D> transition : getTransitions()) {
            if (!firstTransition) {
                sb.append(TRANSITION_SEPARATOR);
            }
            firstTransition = false;
            sb.append(transition);
        }

        if (canEnd()) {
            if (!firstTransition) {
                sb.append(TRANSITION_SEPARATOR);
            }
            sb.append(getEndWeight().getValue()).append(" -> END");
        }
        return sb.toString();
    }
}
