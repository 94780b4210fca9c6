package com.kestrel.automata.api;

/**
 * Creates element distributions from literal elements.
 *
 * @param <E> Element type
 * @param <D> Distribution type
 */
@FunctionalInterface
public interface ElementDistributionFactory<E, D extends ElementDistribution<E, D>> {

    /**
     * Returns the distribution that puts all of its mass on {@code element}.
     */
    D pointMass(E element);
}
