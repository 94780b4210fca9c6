package com.kestrel.automata.core.evaluation;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.SequenceManipulator;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.Transition;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * Scores a sequence against an automaton.
 *
 * <p>The value from a state at a sequence position is the sum, over every
 * non-epsilon transition leaving any member of the state's epsilon closure, of
 * closure weight, transition weight, element probability and the value of the
 * destination at the next position. At the end of the sequence the value is
 * the closure's end weight. Values are memoized on (state, position).
 */
public final class SequenceEvaluator<S, E, D extends ElementDistribution<E, D>> {

    private final Automaton<S, E, D> automaton;
    private final SequenceManipulator<S, E> manipulator;
    private final S sequence;
    private final int length;
    private final Long2ObjectOpenHashMap<Weight> valueCache = new Long2ObjectOpenHashMap<>();

    private SequenceEvaluator(Automaton<S, E, D> automaton, S sequence) {
        this.automaton = automaton;
        this.manipulator = automaton.getAlphabet().sequenceManipulator();
        this.sequence = sequence;
        this.length = manipulator.length(sequence);
    }

    public static <S, E, D extends ElementDistribution<E, D>> double getLogValue(
            Automaton<S, E, D> automaton, int stateIndex, S sequence) {
        return new SequenceEvaluator<>(automaton, sequence).getValue(stateIndex, 0).getLogValue();
    }

    private Weight getValue(int stateIndex, int position) {
        long key = ((long) stateIndex << 32) | position;
        Weight cached = valueCache.get(key);
        if (cached != null) {
            return cached;
        }

        EpsilonClosure<S, E, D> closure = automaton.getEpsilonClosure(stateIndex);
        Weight value = Weight.ZERO;
        if (position < length) {
            E element = manipulator.elementAt(sequence, position);
            for (int i = 0; i < closure.getSize(); i++) {
                Weight closureStateWeight = closure.getStateWeight(i);
                for (Transition<D> transition : closure.getState(i).getTransitions()) {
                    if (transition.isEpsilon() || transition.weight().isZero()) {
                        // epsilon destinations are closure members already
                        continue;
                    }

                    Weight distWeight = Weight.fromLogValue(transition.elementDistribution().getLogProb(element));
                    if (distWeight.isZero()) {
                        continue;
                    }

                    Weight destValue = getValue(transition.destinationStateIndex(), position + 1);
                    if (!destValue.isZero()) {
                        value = Weight.sum(
                                value,
                                Weight.product(closureStateWeight, transition.weight(), distWeight, destValue));
                    }
                }
            }
        } else {
            value = closure.getEndWeight();
        }

        valueCache.put(key, value);
        return value;
    }
}
