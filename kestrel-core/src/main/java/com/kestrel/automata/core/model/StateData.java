package com.kestrel.automata.core.model;

import com.kestrel.automata.api.Weight;

/**
 * Frozen state record. Outgoing transitions occupy the half-open range
 * {@code [firstTransitionIndex, lastTransitionIndex)} of the automaton's transition array.
 */
public record StateData(int firstTransitionIndex, int lastTransitionIndex, Weight endWeight) {

    public StateData {
        if (firstTransitionIndex < 0 || lastTransitionIndex < firstTransitionIndex) {
            throw new IllegalArgumentException(
                    "Invalid transition range [" + firstTransitionIndex + ", " + lastTransitionIndex + ")");
        }
        if (endWeight == null) {
            throw new IllegalArgumentException("endWeight cannot be null");
        }
    }

    public boolean canEnd() {
        return !endWeight.isZero();
    }

    public int transitionCount() {
        return lastTransitionIndex - firstTransitionIndex;
    }
}
