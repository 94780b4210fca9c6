package com.kestrel.automata.core.model;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.ElementDistributionFactory;
import com.kestrel.automata.api.SequenceManipulator;

import java.util.Objects;

/**
 * Everything an automaton needs to know about the sequences it scores:
 * how to read them and how to turn a literal element into a distribution.
 *
 * @param <S> Sequence type
 * @param <E> Element type
 * @param <D> Element distribution type
 */
public record Alphabet<S, E, D extends ElementDistribution<E, D>>(
        SequenceManipulator<S, E> sequenceManipulator,
        ElementDistributionFactory<E, D> distributionFactory
) {
    public Alphabet {
        Objects.requireNonNull(sequenceManipulator, "sequenceManipulator cannot be null");
        Objects.requireNonNull(distributionFactory, "distributionFactory cannot be null");
    }

    public D pointMass(E element) {
        return distributionFactory.pointMass(element);
    }
}
