/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.core.model;

import com.kestrel.automata.api.Weight;

import java.util.Objects;

/**
 * An outgoing transition of an automaton state.
 *
 * <p>A transition without an element distribution is an epsilon transition: it
 * moves to the destination without consuming an element.
 *
 * @param elementDistribution Distribution over the consumed element, {@code null} for epsilon
 * @param weight Transition weight
 * @param destinationStateIndex Index of the destination state
 * @param group Opaque tag assigned by composition, {@code 0} for none
 * @param <D> Element distribution type
 */
public record Transition<D>(
        D elementDistribution,
        Weight weight,
        int destinationStateIndex,
        int group
) {
    public Transition {
        Objects.requireNonNull(weight, "weight cannot be null");
        if (destinationStateIndex < 0) {
            throw new IllegalArgumentException("Destination state index must be non-negative: " + destinationStateIndex);
        }
    }

    public static <D> Transition<D> epsilon(Weight weight, int destinationStateIndex) {
        return new Transition<>(null, weight, destinationStateIndex, 0);
    }

    public boolean isEpsilon() {
        return elementDistribution == null;
    }

    public Transition<D> withWeight(Weight newWeight) {
        return new Transition<>(elementDistribution, newWeight, destinationStateIndex, group);
    }

    public Transition<D> withDestination(int newDestinationStateIndex) {
        return new Transition<>(elementDistribution, weight, newDestinationStateIndex, group);
    }

    public Transition<D> withGroup(int newGroup) {
        return new Transition<>(elementDistribution, weight, destinationStateIndex, newGroup);
    }

    public Transition<D> withElementDistribution(D newElementDistribution) {
        return new Transition<>(newElementDistribution, weight, destinationStateIndex, group);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(isEpsilon() ? "eps" : elementDistribution.toString());
        sb.append(' ').append(weight);
        if (group != 0) {
            sb.append(" #").append(group);
        }
        sb.append(" -> ").append(destinationStateIndex);
        return sb.toString();
    }
}
