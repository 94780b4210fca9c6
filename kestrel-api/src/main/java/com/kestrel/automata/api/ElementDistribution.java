/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.api;

/**
 * A probability distribution over a single sequence element.
 *
 * <p>Automaton transitions carry an element distribution instead of a literal
 * symbol, which lets one transition accept several elements with different
 * probabilities. Implementations must be immutable and implement value equality:
 * the simplifier shares trie edges only between equal distributions.
 *
 * @param <E> Element type
 * @param <D> Concrete distribution type (self type)
 */
public interface ElementDistribution<E, D extends ElementDistribution<E, D>> {

    /**
     * Returns the natural logarithm of the probability of {@code element}.
     * Elements outside of the support yield {@code -inf}.
     */
    double getLogProb(E element);

    /**
     * Returns the normalized pointwise product of this distribution and {@code other}.
     */
    D multiply(D other);

    /**
     * Returns the mixture {@code (w1 * this + w2 * other) / (w1 + w2)}.
     *
     * @param weight1 Weight of this distribution, must be non-negative
     * @param other The second component
     * @param weight2 Weight of {@code other}, must be non-negative
     */
    D weightedSum(double weight1, D other, double weight2);

    /**
     * Returns {@code log sum_e p(e) q(e)}, the log probability that both
     * distributions draw the same element.
     */
    double getLogAverageOf(D other);

    /**
     * Returns the uniform distribution over the support of this distribution.
     */
    D partialUniform();

    /**
     * Whether the whole probability mass sits on a single element.
     */
    boolean isPointMass();

    /**
     * Returns the single element of a point mass.
     *
     * @throws IllegalStateException if this is not a point mass
     */
    E getPoint();
}
