package com.kestrel.automata.simplifier;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.SimplificationListener;
import com.kestrel.automata.core.model.Automaton;

/**
 * Contract for shrinking frozen automata without changing the values they assign.
 * Pruning operations are the exception: they drop low-weight paths on purpose.
 */
public interface IAutomatonSimplifier {

    /**
     * Rewrites the generalized-tree part of the automaton as a trie.
     *
     * @param automaton automaton to simplify
     * @return the simplified automaton, or {@code automaton} itself when it has
     *         loops over more than one transition
     */
    <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> simplify(Automaton<S, E, D> automaton);

    /**
     * Simplifies only when the automaton is larger than the configured state
     * count or pruning is configured.
     */
    <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> simplifyIfNeeded(Automaton<S, E, D> automaton);

    /**
     * Removes states that are unreachable or cannot reach an accepting state.
     */
    <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> removeDeadStates(Automaton<S, E, D> automaton);

    /**
     * Removes transitions with a log weight below {@code logWeightThreshold}
     * and the states that become unreachable.
     */
    <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> removeTransitionsWithSmallWeights(
            Automaton<S, E, D> automaton, double logWeightThreshold);

    /**
     * Sets a listener for tracking simplification phases.
     *
     * @param listener the listener ({@code null} to disable)
     */
    default void setSimplificationListener(SimplificationListener listener) {
    }
}
