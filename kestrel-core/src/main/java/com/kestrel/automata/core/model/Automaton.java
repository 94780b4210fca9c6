/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.core.model;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.InvalidAutomatonStateException;
import com.kestrel.automata.core.config.AutomatonConfig;
import com.kestrel.automata.core.evaluation.AutomatonAnalysis;
import com.kestrel.automata.core.evaluation.EpsilonClosure;
import com.kestrel.automata.core.evaluation.SequenceEvaluator;

import java.util.Objects;

/**
 * Immutable weighted finite-state automaton.
 *
 * <p>States and transitions live in two contiguous arrays. Each state owns a
 * contiguous range of the transition array and transitions refer to their
 * destination by index. Instances are created by
 * {@link com.kestrel.automata.core.builder.AutomatonBuilder#getAutomaton()} and are
 * safe to share between threads.
 *
 * <p>Epsilon closures are computed lazily and cached per automaton in a bounded
 * Caffeine cache sized by {@link AutomatonConfig#getClosureCacheSize()}.
 *
 * @param <S> Sequence type
 * @param <E> Element type
 * @param <D> Element distribution type
 */
public final class Automaton<S, E, D extends ElementDistribution<E, D>> {

    private final Alphabet<S, E, D> alphabet;
    private final StateData[] states;
    private final Transition<D>[] transitions;
    private final int startStateIndex;
    private final boolean epsilonFree;
    private final AutomatonConfig config;

    private volatile Cache<Integer, EpsilonClosure<S, E, D>> closureCache;

    /**
     * Creates an automaton over copies of the given arrays.
     *
     * @throws InvalidAutomatonStateException if the start state index or any
     *         destination index is out of range, or a state's transition range
     *         does not fit the transition array
     */
    public Automaton(
            Alphabet<S, E, D> alphabet,
            StateData[] states,
            Transition<D>[] transitions,
            int startStateIndex,
            AutomatonConfig config) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet cannot be null");
        this.states = Objects.requireNonNull(states, "states cannot be null").clone();
        this.transitions = Objects.requireNonNull(transitions, "transitions cannot be null").clone();
        this.config = Objects.requireNonNull(config, "config cannot be null");

        if (startStateIndex < 0 || startStateIndex >= states.length) {
            throw new InvalidAutomatonStateException(
                    "Automaton must have a valid start state. StartStateIndex = " + startStateIndex
                            + ", states.length = " + states.length);
        }
        this.startStateIndex = startStateIndex;
        this.epsilonFree = validateTransitions();
    }

    public Automaton(Alphabet<S, E, D> alphabet, StateData[] states, Transition<D>[] transitions, int startStateIndex) {
        this(alphabet, states, transitions, startStateIndex, AutomatonConfig.defaults());
    }

    private boolean validateTransitions() {
        for (int i = 0; i < states.length; i++) {
            StateData state = states[i];
            if (state.lastTransitionIndex() > transitions.length) {
                throw new InvalidAutomatonStateException(
                        "State " + i + " references transitions up to " + state.lastTransitionIndex()
                                + " but only " + transitions.length + " exist");
            }
        }

        boolean noEpsilon = true;
        for (int i = 0; i < transitions.length; i++) {
            Transition<D> transition = transitions[i];
            if (transition.destinationStateIndex() >= states.length) {
                throw new InvalidAutomatonStateException(
                        "Transition " + i + " points to state " + transition.destinationStateIndex()
                                + " but only " + states.length + " states exist");
            }
            noEpsilon &= !transition.isEpsilon();
        }
        return noEpsilon;
    }

    /**
     * Creates an automaton with a single non-accepting state, which is zero on every sequence.
     */
    @SuppressWarnings("unchecked")
    public static <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> zero(Alphabet<S, E, D> alphabet) {
        return new Automaton<>(
                alphabet,
                new StateData[] { new StateData(0, 0, Weight.ZERO) },
                (Transition<D>[]) new Transition<?>[0],
                0);
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

    public State<S, E, D> getStart() {
        return new State<>(this, startStateIndex);
    }

    public State<S, E, D> getState(int index) {
        Objects.checkIndex(index, states.length);
        return new State<>(this, index);
    }

    public StateCollection<S, E, D> getStates() {
        return new StateCollection<>(this);
    }

    public int getStateCount() {
        return states.length;
    }

    public int getTransitionCount() {
        return transitions.length;
    }

    /**
     * Whether no transition of this automaton is an epsilon transition.
     */
    public boolean isEpsilonFree() {
        return epsilonFree;
    }

    StateData stateData(int index) {
        return states[index];
    }

    Transition<D>[] transitionArray() {
        return transitions;
    }

    /**
     * Returns the epsilon closure of the given state, computing it on first use.
     */
    public EpsilonClosure<S, E, D> getEpsilonClosure(int stateIndex) {
        Objects.checkIndex(stateIndex, states.length);
        if (epsilonFree) {
            return EpsilonClosure.trivial(this, stateIndex);
        }
        return closureCache().get(stateIndex, index -> EpsilonClosure.compute(this, index));
    }

    private Cache<Integer, EpsilonClosure<S, E, D>> closureCache() {
        Cache<Integer, EpsilonClosure<S, E, D>> cache = closureCache;
        if (cache == null) {
            synchronized (this) {
                cache = closureCache;
                if (cache == null) {
                    cache = Caffeine.newBuilder()
                            .maximumSize(Math.min(config.getClosureCacheSize(), states.length))
                            .build();
                    closureCache = cache;
                }
            }
        }
        return cache;
    }

    /**
     * Computes the logarithm of the value of this automaton on {@code sequence}.
     */
    public double getLogValue(S sequence) {
        return SequenceEvaluator.getLogValue(this, startStateIndex, sequence);
    }

    /**
     * Whether this automaton is zero on every sequence.
     */
    public boolean isZero() {
        return AutomatonAnalysis.isZero(this, startStateIndex);
    }

    /**
     * Whether a cycle over more than one transition is reachable from the start state.
     */
    public boolean hasNonTrivialLoops() {
        return AutomatonAnalysis.hasNonTrivialLoops(this, startStateIndex);
    }

    /**
     * Computes the logarithm of the total weight of all accepted sequences.
     *
     * @throws com.kestrel.automata.api.exceptions.AutomatonException if the automaton has non-trivial loops
     */
    public double getLogNormalizer() {
        return AutomatonAnalysis.getLogNormalizer(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < states.length; i++) {
            sb.append(i).append(": ").append(new State<>(this, i)).append('\n');
        }
        return sb.toString();
    }
}
