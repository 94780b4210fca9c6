package com.kestrel.automata.core.distributions;

import com.kestrel.automata.api.SequenceManipulator;

import java.util.List;

public final class ListManipulator<E> implements SequenceManipulator<List<E>, E> {

    @Override
    public int length(List<E> sequence) {
        return sequence.size();
    }

    @Override
    public E elementAt(List<E> sequence, int index) {
        return sequence.get(index);
    }

    @Override
    public List<E> toSequence(List<E> elements) {
        return List.copyOf(elements);
    }

    @Override
    public Iterable<E> elements(List<E> sequence) {
        return sequence;
    }
}
