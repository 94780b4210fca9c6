package com.kestrel.automata.core.model;

import java.util.AbstractList;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Bounds-checked view over the outgoing transitions of one state. Shares the
 * automaton's transition array.
 */
public final class TransitionList<D> extends AbstractList<Transition<D>> implements RandomAccess {

    private final Transition<D>[] transitions;
    private final int begin;
    private final int end;

    TransitionList(Transition<D>[] transitions, int begin, int end) {
        this.transitions = transitions;
        this.begin = begin;
        this.end = end;
    }

    @Override
    public Transition<D> get(int index) {
        Objects.checkIndex(index, end - begin);
        return transitions[begin + index];
    }

    @Override
    public int size() {
        return end - begin;
    }
}
