/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.core.evaluation;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.AutomatonException;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.State;
import com.kestrel.automata.core.model.Transition;
import com.kestrel.automata.core.model.TransitionList;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * The states reachable from a given state through epsilon transitions only,
 * each with the total weight of the epsilon paths leading to it.
 *
 * <p>The first member is always the state the closure was computed for. Members
 * are listed in topological order of the epsilon graph. An epsilon self-loop of
 * weight {@code w} multiplies the weight of its state by {@code 1 / (1 - w)}.
 *
 * <p>Epsilon cycles spanning more than one state have no finite closure
 * representation here and are rejected.
 */
public final class EpsilonClosure<S, E, D extends ElementDistribution<E, D>> {

    private static final int IN_STACK = 1;
    private static final int DONE = 2;

    private final Automaton<S, E, D> owner;
    private final int[] stateIndices;
    private final Weight[] weights;
    private final Weight endWeight;

    private EpsilonClosure(Automaton<S, E, D> owner, int[] stateIndices, Weight[] weights, Weight endWeight) {
        this.owner = owner;
        this.stateIndices = stateIndices;
        this.weights = weights;
        this.endWeight = endWeight;
    }

    /**
     * Closure of a state that has no outgoing epsilon transitions.
     */
    public static <S, E, D extends ElementDistribution<E, D>> EpsilonClosure<S, E, D> trivial(
            Automaton<S, E, D> automaton, int stateIndex) {
        return new EpsilonClosure<>(
                automaton,
                new int[] { stateIndex },
                new Weight[] { Weight.ONE },
                automaton.getState(stateIndex).getEndWeight());
    }

    public static <S, E, D extends ElementDistribution<E, D>> EpsilonClosure<S, E, D> compute(
            Automaton<S, E, D> automaton, int stateIndex) {
        IntArrayList order = topologicalOrder(automaton, stateIndex);

        Int2ObjectOpenHashMap<Weight> incoming = new Int2ObjectOpenHashMap<>(order.size());
        incoming.put(stateIndex, Weight.ONE);

        int[] indices = new int[order.size()];
        Weight[] weights = new Weight[order.size()];
        Weight endWeight = Weight.ZERO;

        for (int i = 0; i < order.size(); i++) {
            int current = order.getInt(i);
            TransitionList<D> transitions = automaton.getState(current).getTransitions();

            Weight selfLoopWeight = Weight.ZERO;
            for (Transition<D> transition : transitions) {
                if (transition.isEpsilon() && transition.destinationStateIndex() == current) {
                    selfLoopWeight = Weight.sum(selfLoopWeight, transition.weight());
                }
            }

            Weight weight = Weight.product(incoming.get(current), Weight.approximateClosure(selfLoopWeight));
            indices[i] = current;
            weights[i] = weight;
            endWeight = Weight.sum(endWeight, Weight.product(weight, automaton.getState(current).getEndWeight()));

            for (Transition<D> transition : transitions) {
                int destination = transition.destinationStateIndex();
                if (transition.isEpsilon() && destination != current) {
                    Weight pathWeight = Weight.product(weight, transition.weight());
                    Weight previous = incoming.get(destination);
                    incoming.put(destination, previous == null ? pathWeight : Weight.sum(previous, pathWeight));
                }
            }
        }

        return new EpsilonClosure<>(automaton, indices, weights, endWeight);
    }

    /**
     * Reverse post-order of the epsilon graph reachable from {@code root}, self-loops excluded.
     */
    private static <S, E, D extends ElementDistribution<E, D>> IntArrayList topologicalOrder(
            Automaton<S, E, D> automaton, int root) {
        Int2IntOpenHashMap color = new Int2IntOpenHashMap();
        IntArrayList postOrder = new IntArrayList();

        // Each frame is a state and the position of the next transition to look at
        IntArrayList stateStack = new IntArrayList();
        IntArrayList positionStack = new IntArrayList();
        stateStack.add(root);
        positionStack.add(0);
        color.put(root, IN_STACK);

        while (!stateStack.isEmpty()) {
            int top = stateStack.size() - 1;
            int current = stateStack.getInt(top);
            int position = positionStack.getInt(top);
            TransitionList<D> transitions = automaton.getState(current).getTransitions();

            if (position == transitions.size()) {
                stateStack.removeInt(top);
                positionStack.removeInt(top);
                color.put(current, DONE);
                postOrder.add(current);
                continue;
            }

            positionStack.set(top, position + 1);
            Transition<D> transition = transitions.get(position);
            int destination = transition.destinationStateIndex();
            if (!transition.isEpsilon() || destination == current) {
                continue;
            }

            int destinationColor = color.get(destination);
            if (destinationColor == IN_STACK) {
                throw new AutomatonException(
                        "Epsilon cycle through states " + current + " and " + destination
                                + " prevents computing the epsilon closure of state " + root);
            }
            if (destinationColor == 0) {
                color.put(destination, IN_STACK);
                stateStack.add(destination);
                positionStack.add(0);
            }
        }

        IntArrayList order = new IntArrayList(postOrder.size());
        for (int i = postOrder.size() - 1; i >= 0; i--) {
            order.add(postOrder.getInt(i));
        }
        return order;
    }

    public int getSize() {
        return stateIndices.length;
    }

    public int getStateIndex(int memberIndex) {
        return stateIndices[memberIndex];
    }

    public State<S, E, D> getState(int memberIndex) {
        return owner.getState(stateIndices[memberIndex]);
    }

    public Weight getStateWeight(int memberIndex) {
        return weights[memberIndex];
    }

    /**
     * Sum over members of member weight times member end weight.
     */
    public Weight getEndWeight() {
        return endWeight;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EpsilonClosure{");
        for (int i = 0; i < stateIndices.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(stateIndices[i]).append('=').append(weights[i]);
        }
        return sb.append(", end=").append(endWeight).append('}').toString();
    }
}
