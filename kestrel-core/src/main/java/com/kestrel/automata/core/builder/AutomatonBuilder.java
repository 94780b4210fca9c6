/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.core.builder;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.AutomatonInvariantException;
import com.kestrel.automata.api.exceptions.InvalidAutomatonStateException;
import com.kestrel.automata.core.config.AutomatonConfig;
import com.kestrel.automata.core.model.Alphabet;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.State;
import com.kestrel.automata.core.model.StateCollection;
import com.kestrel.automata.core.model.StateData;
import com.kestrel.automata.core.model.Transition;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Mutable working representation of an automaton.
 *
 * <p>States and transitions are stored as parallel arrays (structure-of-arrays).
 * Each state keeps the head and tail of a singly linked list threaded through
 * one shared transition arena, which makes adding a transition O(1). Removed
 * transitions are tombstoned in place and dropped only when
 * {@link #getAutomaton()} compacts the arena into a frozen {@link Automaton}.
 * Every traversal primitive skips tombstones.
 *
 * <p>States and transitions refer to each other by index only. Removing a state
 * shifts every higher state index down by one.
 *
 * <p>Not thread-safe: a builder must have a single owner while it is mutated.
 *
 * @param <S> Sequence type
 * @param <E> Element type
 * @param <D> Element distribution type
 */
public class AutomatonBuilder<S, E, D extends ElementDistribution<E, D>> {
    private static final Logger logger = Logger.getLogger(AutomatonBuilder.class.getName());

    private static final int NO_TRANSITION = -1;

    private final Alphabet<S, E, D> alphabet;
    private final AutomatonConfig config;

    // States
    private final IntArrayList firstTransition = new IntArrayList();
    private final IntArrayList lastTransition = new IntArrayList();
    private final ObjectArrayList<Weight> endWeights = new ObjectArrayList<>();

    // Transition arena
    private final ObjectArrayList<Transition<D>> transitions = new ObjectArrayList<>();
    private final IntArrayList nextTransition = new IntArrayList();
    private final BooleanArrayList removedTransition = new BooleanArrayList();
    private int numRemovedTransitions;

    private int startStateIndex;

    public AutomatonBuilder(Alphabet<S, E, D> alphabet) {
        this(alphabet, AutomatonConfig.defaults());
    }

    public AutomatonBuilder(Alphabet<S, E, D> alphabet, AutomatonConfig config) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Creates a builder with a single non-accepting start state.
     */
    public static <S, E, D extends ElementDistribution<E, D>> AutomatonBuilder<S, E, D> zero(Alphabet<S, E, D> alphabet) {
        return zero(alphabet, AutomatonConfig.defaults());
    }

    public static <S, E, D extends ElementDistribution<E, D>> AutomatonBuilder<S, E, D> zero(
            Alphabet<S, E, D> alphabet, AutomatonConfig config) {
        AutomatonBuilder<S, E, D> builder = new AutomatonBuilder<>(alphabet, config);
        builder.addState();
        return builder;
    }

    /**
     * Creates a builder holding a copy of {@code automaton}.
     */
    public static <S, E, D extends ElementDistribution<E, D>> AutomatonBuilder<S, E, D> fromAutomaton(
            Automaton<S, E, D> automaton) {
        AutomatonBuilder<S, E, D> builder = new AutomatonBuilder<>(automaton.getAlphabet(), automaton.getConfig());
        builder.addStates(automaton.getStates());
        builder.startStateIndex = automaton.getStartStateIndex();
        return builder;
    }

    /**
     * Creates a builder for the automaton that maps {@code sequence} to {@code weight}
     * and every other sequence to zero.
     */
    public static <S, E, D extends ElementDistribution<E, D>> AutomatonBuilder<S, E, D> constantOn(
            Alphabet<S, E, D> alphabet, Weight weight, S sequence) {
        AutomatonBuilder<S, E, D> builder = zero(alphabet);
        builder.getStart().addTransitionsForSequence(sequence).setEndWeight(weight);
        return builder;
    }

    public Alphabet<S, E, D> getAlphabet() {
        return alphabet;
    }

    public AutomatonConfig getConfig() {
        return config;
    }

    public int getStartStateIndex() {
        return startStateIndex;
    }

    /**
     * Sets the start state. The index is validated when the automaton is built.
     */
    public void setStartStateIndex(int startStateIndex) {
        this.startStateIndex = startStateIndex;
    }

    public int getStatesCount() {
        return endWeights.size();
    }

    /**
     * Number of live (not tombstoned) transitions.
     */
    public int getTransitionCount() {
        return transitions.size() - numRemovedTransitions;
    }

    public StateBuilder get(int index) {
        Objects.checkIndex(index, getStatesCount());
        return new StateBuilder(index);
    }

    public StateBuilder getStart() {
        return get(startStateIndex);
    }

    /**
     * Adds a state with zero end weight and no transitions.
     */
    public StateBuilder addState() {
        int index = endWeights.size();
        firstTransition.add(NO_TRANSITION);
        lastTransition.add(NO_TRANSITION);
        endWeights.add(Weight.ZERO);
        return new StateBuilder(index);
    }

    public void addStates(int count) {
        for (int i = 0; i < count; i++) {
            addState();
        }
    }

    /**
     * Appends copies of {@code states}; their destination indices are shifted by
     * the number of states this builder had before the call.
     */
    public void addStates(StateCollection<S, E, D> states) {
        addStates(states, 0);
    }

    private void addStates(StateCollection<S, E, D> states, int group) {
        int offset = getStatesCount();
        for (State<S, E, D> state : states) {
            StateBuilder stateBuilder = addState();
            stateBuilder.setEndWeight(state.getEndWeight());
            for (Transition<D> transition : state.getTransitions()) {
                Transition<D> updated = transition.withDestination(transition.destinationStateIndex() + offset);
                if (group != 0) {
                    updated = updated.withGroup(group);
                }
                stateBuilder.addTransition(updated);
            }
        }
    }

    /**
     * Removes every state and transition. The start state index is reset to zero.
     */
    public void clear() {
        firstTransition.clear();
        lastTransition.clear();
        endWeights.clear();
        transitions.clear();
        nextTransition.clear();
        removedTransition.clear();
        numRemovedTransitions = 0;
        startStateIndex = 0;
    }

    /**
     * Replaces the content of this builder with the content of {@code other}.
     * {@code other} must not be used afterwards.
     */
    public void replaceWith(AutomatonBuilder<S, E, D> other) {
        if (other == this) {
            return;
        }
        clear();
        firstTransition.addAll(other.firstTransition);
        lastTransition.addAll(other.lastTransition);
        endWeights.addAll(other.endWeights);
        transitions.addAll(other.transitions);
        nextTransition.addAll(other.nextTransition);
        removedTransition.addAll(other.removedTransition);
        numRemovedTransitions = other.numRemovedTransitions;
        startStateIndex = other.startStateIndex;
    }

    public void append(Automaton<S, E, D> automaton) {
        append(automaton, 0, true);
    }

    public void append(Automaton<S, E, D> automaton, int group) {
        append(automaton, group, true);
    }

    /**
     * Concatenates {@code automaton} onto the accepting states of this builder.
     *
     * <p>The states of {@code automaton} are copied with shifted indices, stamped
     * with {@code group} when it is non-zero. Let {@code S} be the copied start
     * state. When epsilon transitions are to be avoided and either no accepting
     * state has outgoing transitions or {@code S} has no incoming transitions,
     * {@code S} is fused into every accepting state and removed. Otherwise each
     * accepting state gets an epsilon transition to {@code S} carrying its former
     * end weight, and stops accepting.
     *
     * @param automaton The automaton to append
     * @param group Group assigned to the copied transitions, {@code 0} to keep theirs
     * @param avoidEpsilonTransitions Whether fusing the start state may be attempted
     */
    public void append(Automaton<S, E, D> automaton, int group, boolean avoidEpsilonTransitions) {
        int oldStateCount = getStatesCount();
        addStates(automaton.getStates(), group);
        int secondStartIndex = oldStateCount + automaton.getStartStateIndex();

        if (oldStateCount == 0) {
            startStateIndex = secondStartIndex;
            return;
        }

        State<S, E, D> secondStart = automaton.getStart();
        boolean canFuse = avoidEpsilonTransitions
                && (allEndStatesHaveNoTransitions(oldStateCount) || !secondStart.hasIncomingTransitions())
                && !hasIncomingTransitionsFromOtherStates(secondStart);

        if (canFuse) {
            fuseStartState(oldStateCount, secondStartIndex, group);
        } else {
            for (int i = 0; i < oldStateCount; i++) {
                Weight endWeight = endWeights.get(i);
                if (!endWeight.isZero()) {
                    get(i).addEpsilonTransition(endWeight, secondStartIndex, group);
                    endWeights.set(i, Weight.ZERO);
                }
            }
        }
    }

    private void fuseStartState(int oldStateCount, int secondStartIndex, int group) {
        Weight secondEndWeight = endWeights.get(secondStartIndex);
        for (int i = 0; i < oldStateCount; i++) {
            Weight endWeight = endWeights.get(i);
            if (endWeight.isZero()) {
                continue;
            }

            StateBuilder endState = get(i);
            for (TransitionIterator it = get(secondStartIndex).transitionIterator(); it.ok(); it.next()) {
                Transition<D> transition = it.value();
                if (group != 0) {
                    transition = transition.withGroup(group);
                }
                if (transition.destinationStateIndex() == secondStartIndex) {
                    transition = transition.withDestination(i);
                } else {
                    transition = transition.withWeight(Weight.product(transition.weight(), endWeight));
                }
                endState.addTransition(transition);
            }
            endState.setEndWeight(Weight.product(endWeight, secondEndWeight));
        }

        removeState(secondStartIndex);
    }

    private boolean allEndStatesHaveNoTransitions(int oldStateCount) {
        for (int i = 0; i < oldStateCount; i++) {
            if (!endWeights.get(i).isZero() && get(i).hasTransitions()) {
                return false;
            }
        }
        return true;
    }

    private static <S, E, D extends ElementDistribution<E, D>> boolean hasIncomingTransitionsFromOtherStates(
            State<S, E, D> state) {
        for (State<S, E, D> other : state.getOwner().getStates()) {
            if (other.getIndex() == state.getIndex()) {
                continue;
            }
            for (Transition<D> transition : other.getTransitions()) {
                if (transition.destinationStateIndex() == state.getIndex()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Removes the state at {@code stateIndex}.
     *
     * <p>Its outgoing transitions and every transition leading to it are
     * tombstoned, and every destination index above {@code stateIndex} is
     * decremented. The start state index is adjusted accordingly.
     *
     * @throws IllegalArgumentException if {@code stateIndex} is the start state
     */
    public void removeState(int stateIndex) {
        Objects.checkIndex(stateIndex, getStatesCount());
        if (stateIndex == startStateIndex) {
            throw new IllegalArgumentException("Cannot remove the start state " + stateIndex);
        }

        for (int t = firstTransition.getInt(stateIndex); t != NO_TRANSITION; t = nextTransition.getInt(t)) {
            tombstone(t);
        }

        firstTransition.removeInt(stateIndex);
        lastTransition.removeInt(stateIndex);
        endWeights.remove(stateIndex);

        int stateCount = getStatesCount();
        for (int i = 0; i < stateCount; i++) {
            for (TransitionIterator it = new TransitionIterator(firstTransition.getInt(i)); it.ok(); it.next()) {
                int destination = it.value().destinationStateIndex();
                if (destination == stateIndex) {
                    it.markRemoved();
                } else if (destination > stateIndex) {
                    it.setValue(it.value().withDestination(destination - 1));
                }
            }
        }

        if (startStateIndex > stateIndex) {
            startStateIndex--;
        }
    }

    /**
     * Removes every state flagged in {@code toRemove} in a single pass over the arena.
     * Surviving states keep their relative order.
     *
     * @param toRemove One flag per state
     * @return The number of removed states
     * @throws IllegalArgumentException if the flags do not match the state count or flag the start state
     */
    public int removeStates(boolean[] toRemove) {
        int stateCount = getStatesCount();
        if (toRemove.length != stateCount) {
            throw new IllegalArgumentException(
                    "Expected " + stateCount + " removal flags but got " + toRemove.length);
        }
        if (startStateIndex >= 0 && startStateIndex < stateCount && toRemove[startStateIndex]) {
            throw new IllegalArgumentException("Cannot remove the start state " + startStateIndex);
        }

        int[] newIndex = new int[stateCount];
        int kept = 0;
        for (int i = 0; i < stateCount; i++) {
            newIndex[i] = toRemove[i] ? -1 : kept++;
        }
        int removedCount = stateCount - kept;
        if (removedCount == 0) {
            return 0;
        }

        for (int i = 0; i < stateCount; i++) {
            if (toRemove[i]) {
                for (int t = firstTransition.getInt(i); t != NO_TRANSITION; t = nextTransition.getInt(t)) {
                    tombstone(t);
                }
                continue;
            }
            for (TransitionIterator it = new TransitionIterator(firstTransition.getInt(i)); it.ok(); it.next()) {
                int destination = it.value().destinationStateIndex();
                if (toRemove[destination]) {
                    it.markRemoved();
                } else if (newIndex[destination] != destination) {
                    it.setValue(it.value().withDestination(newIndex[destination]));
                }
            }
        }

        int target = 0;
        for (int i = 0; i < stateCount; i++) {
            if (!toRemove[i]) {
                firstTransition.set(target, firstTransition.getInt(i));
                lastTransition.set(target, lastTransition.getInt(i));
                endWeights.set(target, endWeights.get(i));
                target++;
            }
        }
        firstTransition.size(kept);
        lastTransition.size(kept);
        endWeights.size(kept);

        if (startStateIndex >= 0 && startStateIndex < stateCount) {
            startStateIndex = newIndex[startStateIndex];
        }

        logger.fine("Removed " + removedCount + " of " + stateCount + " states");
        return removedCount;
    }

    private void tombstone(int transitionIndex) {
        if (!removedTransition.getBoolean(transitionIndex)) {
            removedTransition.set(transitionIndex, true);
            numRemovedTransitions++;
        }
    }

    /**
     * Compacts this builder into a frozen automaton.
     *
     * <p>Live transitions are copied state by state into a fresh array, so the
     * result never shares storage with the builder.
     *
     * @throws InvalidAutomatonStateException if the start state index is out of range
     *         or a transition points to a missing state
     */
    @SuppressWarnings("unchecked")
    public Automaton<S, E, D> getAutomaton() {
        int stateCount = getStatesCount();
        if (startStateIndex < 0 || startStateIndex >= stateCount) {
            throw new InvalidAutomatonStateException(
                    "Built automaton must have a valid start state. StartStateIndex = " + startStateIndex
                            + ", states.Count = " + stateCount);
        }

        StateData[] resultStates = new StateData[stateCount];
        Transition<D>[] resultTransitions = (Transition<D>[]) new Transition<?>[getTransitionCount()];
        int nextResultIndex = 0;

        for (int i = 0; i < stateCount; i++) {
            int first = nextResultIndex;
            for (int t = firstTransition.getInt(i); t != NO_TRANSITION; t = nextTransition.getInt(t)) {
                if (removedTransition.getBoolean(t)) {
                    continue;
                }
                if (nextResultIndex == resultTransitions.length) {
                    throw new AutomatonInvariantException(
                            "Builder holds more live transitions than its removal count allows");
                }
                resultTransitions[nextResultIndex++] = transitions.get(t);
            }
            resultStates[i] = new StateData(first, nextResultIndex, endWeights.get(i));
        }

        if (nextResultIndex != resultTransitions.length) {
            throw new AutomatonInvariantException(
                    "Expected " + resultTransitions.length + " live transitions but found " + nextResultIndex);
        }

        return new Automaton<>(alphabet, resultStates, resultTransitions, startStateIndex, config);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < getStatesCount(); i++) {
            sb.append(i == startStateIndex ? "START " : "").append(i).append(':');
            for (TransitionIterator it = new TransitionIterator(firstTransition.getInt(i)); it.ok(); it.next()) {
                sb.append(' ').append(it.value()).append(';');
            }
            if (!endWeights.get(i).isZero()) {
                sb.append(' ').append(endWeights.get(i)).append(" -> END");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Handle to a state of the enclosing builder. Only valid until the next state removal.
     */
    public final class StateBuilder {
        private final int index;

        private StateBuilder(int index) {
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        public Weight getEndWeight() {
            return endWeights.get(index);
        }

        public void setEndWeight(Weight weight) {
            endWeights.set(index, Objects.requireNonNull(weight, "weight cannot be null"));
        }

        public boolean canEnd() {
            return !endWeights.get(index).isZero();
        }

        /**
         * Whether the state has at least one live transition.
         */
        public boolean hasTransitions() {
            return transitionIterator().ok();
        }

        /**
         * Appends {@code transition} to the tail of this state's transition list.
         *
         * @return The destination state
         */
        public StateBuilder addTransition(Transition<D> transition) {
            int transitionIndex = transitions.size();
            transitions.add(transition);
            nextTransition.add(NO_TRANSITION);
            removedTransition.add(false);

            int tail = lastTransition.getInt(index);
            if (tail == NO_TRANSITION) {
                firstTransition.set(index, transitionIndex);
            } else {
                nextTransition.set(tail, transitionIndex);
            }
            lastTransition.set(index, transitionIndex);
            return new StateBuilder(transition.destinationStateIndex());
        }

        /**
         * Adds a transition consuming {@code element} to a new state.
         */
        public StateBuilder addTransition(E element, Weight weight) {
            return addTransition(element, weight, null, 0);
        }

        /**
         * Adds a transition consuming {@code element}.
         *
         * @param destinationStateIndex Destination, or {@code null} to create a new state
         */
        public StateBuilder addTransition(E element, Weight weight, Integer destinationStateIndex, int group) {
            return addDistributionTransition(alphabet.pointMass(element), weight, destinationStateIndex, group);
        }

        public StateBuilder addDistributionTransition(D elementDistribution, Weight weight) {
            return addDistributionTransition(elementDistribution, weight, null, 0);
        }

        /**
         * Adds a transition consuming an element drawn from {@code elementDistribution}.
         *
         * @param elementDistribution Distribution of the consumed element, {@code null} for an epsilon transition
         * @param destinationStateIndex Destination, or {@code null} to create a new state
         */
        public StateBuilder addDistributionTransition(
                D elementDistribution, Weight weight, Integer destinationStateIndex, int group) {
            int destination = destinationStateIndex == null ? addState().getIndex() : destinationStateIndex;
            return addTransition(new Transition<>(elementDistribution, weight, destination, group));
        }

        public StateBuilder addEpsilonTransition(Weight weight) {
            return addDistributionTransition(null, weight, null, 0);
        }

        public StateBuilder addEpsilonTransition(Weight weight, Integer destinationStateIndex) {
            return addDistributionTransition(null, weight, destinationStateIndex, 0);
        }

        public StateBuilder addEpsilonTransition(Weight weight, Integer destinationStateIndex, int group) {
            return addDistributionTransition(null, weight, destinationStateIndex, group);
        }

        public StateBuilder addSelfTransition(E element, Weight weight) {
            return addTransition(element, weight, index, 0);
        }

        public StateBuilder addSelfTransition(E element, Weight weight, int group) {
            return addTransition(element, weight, index, group);
        }

        /**
         * Adds a self-loop, an epsilon self-loop when {@code elementDistribution} is {@code null}.
         *
         * @return This state
         */
        public StateBuilder addSelfDistributionTransition(D elementDistribution, Weight weight, int group) {
            return addDistributionTransition(elementDistribution, weight, index, group);
        }

        public StateBuilder addTransitionsForSequence(S sequence) {
            return addTransitionsForSequence(sequence, null, 0);
        }

        /**
         * Adds a chain of unit-weight transitions, one per element of {@code sequence},
         * through freshly created intermediate states.
         *
         * @param destinationStateIndex Last state of the chain, or {@code null} to create a new one
         * @return The last state of the chain, this state for an empty sequence
         */
        public StateBuilder addTransitionsForSequence(S sequence, Integer destinationStateIndex, int group) {
            int length = alphabet.sequenceManipulator().length(sequence);
            StateBuilder current = this;
            for (int i = 0; i < length; i++) {
                E element = alphabet.sequenceManipulator().elementAt(sequence, i);
                current = current.addTransition(
                        element, Weight.ONE, i == length - 1 ? destinationStateIndex : null, group);
            }
            return current;
        }

        public TransitionIterator transitionIterator() {
            return new TransitionIterator(firstTransition.getInt(index));
        }

        @Override
        public String toString() {
            return "StateBuilder{" + index + '}';
        }
    }

    /**
     * Cursor over the live transitions of one state. Tombstoned transitions are
     * skipped when the cursor is created and on every {@link #next()}.
     */
    public final class TransitionIterator {
        private int current;

        private TransitionIterator(int start) {
            this.current = skipRemoved(start);
        }

        private int skipRemoved(int transitionIndex) {
            while (transitionIndex != NO_TRANSITION && removedTransition.getBoolean(transitionIndex)) {
                transitionIndex = nextTransition.getInt(transitionIndex);
            }
            return transitionIndex;
        }

        public boolean ok() {
            return current != NO_TRANSITION;
        }

        public void next() {
            current = skipRemoved(nextTransition.getInt(current));
        }

        public Transition<D> value() {
            return transitions.get(current);
        }

        public void setValue(Transition<D> transition) {
            transitions.set(current, Objects.requireNonNull(transition, "transition cannot be null"));
        }

        /**
         * Tombstones the current transition. The cursor stays in place; call {@link #next()} to advance.
         */
        public void markRemoved() {
            tombstone(current);
        }

        public TransitionIterator copy() {
            TransitionIterator copy = new TransitionIterator(NO_TRANSITION);
            copy.current = current;
            return copy;
        }
    }
}
