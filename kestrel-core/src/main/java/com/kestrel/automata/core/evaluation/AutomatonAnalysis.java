package com.kestrel.automata.core.evaluation;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.AutomatonException;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.Transition;
import com.kestrel.automata.core.model.TransitionList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.BitSet;

/**
 * Structural checks over frozen automata. Every traversal keeps its own work
 * stack, so deep automata do not exhaust the call stack.
 */
public final class AutomatonAnalysis {

    private static final byte UNVISITED = 0;
    private static final byte IN_STACK = 1;
    private static final byte DONE = 2;

    private AutomatonAnalysis() {
    }

    /**
     * Whether no accepting state is reachable from {@code stateIndex} through
     * transitions with non-zero weight.
     */
    public static <S, E, D extends ElementDistribution<E, D>> boolean isZero(
            Automaton<S, E, D> automaton, int stateIndex) {
        BitSet visited = new BitSet(automaton.getStateCount());
        IntArrayList stack = new IntArrayList();
        stack.add(stateIndex);
        visited.set(stateIndex);

        while (!stack.isEmpty()) {
            int current = stack.popInt();
            if (automaton.getState(current).canEnd()) {
                return false;
            }
            for (Transition<D> transition : automaton.getState(current).getTransitions()) {
                int destination = transition.destinationStateIndex();
                if (!transition.weight().isZero() && !visited.get(destination)) {
                    visited.set(destination);
                    stack.add(destination);
                }
            }
        }
        return true;
    }

    /**
     * Whether a cycle over more than one transition is reachable from {@code stateIndex}.
     * Self-loops are ignored.
     */
    public static <S, E, D extends ElementDistribution<E, D>> boolean hasNonTrivialLoops(
            Automaton<S, E, D> automaton, int stateIndex) {
        byte[] color = new byte[automaton.getStateCount()];
        IntArrayList stateStack = new IntArrayList();
        IntArrayList positionStack = new IntArrayList();
        stateStack.add(stateIndex);
        positionStack.add(0);
        color[stateIndex] = IN_STACK;

        while (!stateStack.isEmpty()) {
            int top = stateStack.size() - 1;
            int current = stateStack.getInt(top);
            int position = positionStack.getInt(top);
            TransitionList<D> transitions = automaton.getState(current).getTransitions();

            if (position == transitions.size()) {
                color[current] = DONE;
                stateStack.removeInt(top);
                positionStack.removeInt(top);
                continue;
            }

            positionStack.set(top, position + 1);
            int destination = transitions.get(position).destinationStateIndex();
            if (destination == current) {
                continue;
            }
            if (color[destination] == IN_STACK) {
                return true;
            }
            if (color[destination] == UNVISITED) {
                color[destination] = IN_STACK;
                stateStack.add(destination);
                positionStack.add(0);
            }
        }
        return false;
    }

    /**
     * Computes the log of the total weight the automaton assigns to all sequences.
     *
     * <p>Element distributions are taken to be normalized, so a transition
     * contributes just its weight. A self-loop of total weight {@code w} contributes
     * the factor {@code 1 / (1 - w)}, or infinity when {@code w >= 1}.
     *
     * @throws AutomatonException if the automaton has non-trivial loops
     */
    public static <S, E, D extends ElementDistribution<E, D>> double getLogNormalizer(Automaton<S, E, D> automaton) {
        int start = automaton.getStartStateIndex();
        if (hasNonTrivialLoops(automaton, start)) {
            throw new AutomatonException("Cannot compute the normalizer of an automaton with non-trivial loops");
        }

        Weight[] mass = new Weight[automaton.getStateCount()];
        IntArrayList stateStack = new IntArrayList();
        IntArrayList positionStack = new IntArrayList();
        stateStack.add(start);
        positionStack.add(0);

        while (!stateStack.isEmpty()) {
            int top = stateStack.size() - 1;
            int current = stateStack.getInt(top);
            int position = positionStack.getInt(top);
            TransitionList<D> transitions = automaton.getState(current).getTransitions();

            // Descend into the first child that has no mass yet
            boolean descended = false;
            while (position < transitions.size()) {
                int destination = transitions.get(position++).destinationStateIndex();
                if (destination != current && mass[destination] == null) {
                    positionStack.set(top, position);
                    stateStack.add(destination);
                    positionStack.add(0);
                    descended = true;
                    break;
                }
            }
            if (descended) {
                continue;
            }

            Weight selfLoopWeight = Weight.ZERO;
            Weight total = automaton.getState(current).getEndWeight();
            for (Transition<D> transition : transitions) {
                int destination = transition.destinationStateIndex();
                if (destination == current) {
                    selfLoopWeight = Weight.sum(selfLoopWeight, transition.weight());
                } else {
                    total = Weight.sum(total, Weight.product(transition.weight(), mass[destination]));
                }
            }
            mass[current] = Weight.product(Weight.approximateClosure(selfLoopWeight), total);
            stateStack.removeInt(top);
            positionStack.removeInt(top);
        }

        return mass[start].getLogValue();
    }
}
