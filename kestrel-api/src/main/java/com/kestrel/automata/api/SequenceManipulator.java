package com.kestrel.automata.api;

import java.util.List;

/**
 * Gives automata uniform access to a sequence type, such as {@code String}
 * (of {@code Character}) or {@code List<E>}.
 *
 * @param <S> Sequence type
 * @param <E> Element type
 */
public interface SequenceManipulator<S, E> {

    int length(S sequence);

    E elementAt(S sequence, int index);

    S toSequence(List<E> elements);

    /**
     * Enumerates the elements of {@code sequence} in order.
     */
    default Iterable<E> elements(S sequence) {
        return () -> new java.util.Iterator<>() {
            private final int length = length(sequence);
            private int position;

            @Override
            public boolean hasNext() {
                return position < length;
            }

            @Override
            public E next() {
                if (position >= length) {
                    throw new java.util.NoSuchElementException();
                }
                return elementAt(sequence, position++);
            }
        };
    }
}
