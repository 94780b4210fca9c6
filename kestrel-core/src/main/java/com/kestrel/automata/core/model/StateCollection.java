package com.kestrel.automata.core.model;

import com.kestrel.automata.api.ElementDistribution;

import java.util.AbstractList;
import java.util.RandomAccess;

/**
 * All states of an automaton, in index order.
 */
public final class StateCollection<S, E, D extends ElementDistribution<E, D>>
        extends AbstractList<State<S, E, D>> implements RandomAccess {

    private final Automaton<S, E, D> owner;

    StateCollection(Automaton<S, E, D> owner) {
        this.owner = owner;
    }

    public Automaton<S, E, D> getOwner() {
        return owner;
    }

    @Override
    public State<S, E, D> get(int index) {
        return owner.getState(index);
    }

    @Override
    public int size() {
        return owner.getStateCount();
    }
}
