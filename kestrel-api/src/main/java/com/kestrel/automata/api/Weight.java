/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.api;

import java.io.Serializable;

/**
 * An element of the non-negative real semiring, stored as a natural logarithm.
 *
 * <p>Weights score paths through an automaton: transition weights are multiplied
 * along a path and the scores of alternative paths are summed. Keeping the value
 * in log space allows very small and very large weights to be combined without
 * underflow.
 *
 * <p>Instances are immutable and compared by their log value.
 */
public final class Weight implements Serializable {
    private static final long serialVersionUID = 1L;

    /** The additive identity ({@code log = -inf}). */
    public static final Weight ZERO = new Weight(Double.NEGATIVE_INFINITY);

    /** The multiplicative identity ({@code log = 0}). */
    public static final Weight ONE = new Weight(0.0);

    /** The weight with an infinite value. */
    public static final Weight INFINITY = new Weight(Double.POSITIVE_INFINITY);

    private final double logValue;

    private Weight(double logValue) {
        this.logValue = logValue;
    }

    /**
     * Creates a weight from the logarithm of its value.
     *
     * @param logValue The log value, {@code -inf} for zero.
     * @return The weight.
     */
    public static Weight fromLogValue(double logValue) {
        if (Double.isNaN(logValue)) {
            throw new IllegalArgumentException("Weight log value must not be NaN");
        }
        if (logValue == Double.NEGATIVE_INFINITY) {
            return ZERO;
        }
        if (logValue == 0.0) {
            return ONE;
        }
        return new Weight(logValue);
    }

    /**
     * Creates a weight from its (linear) value.
     *
     * @param value A non-negative value.
     * @return The weight.
     */
    public static Weight fromValue(double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("Weight value must be non-negative, got: " + value);
        }
        return fromLogValue(Math.log(value));
    }

    /**
     * Computes {@code a + b}.
     */
    public static Weight sum(Weight a, Weight b) {
        if (a.isZero()) {
            return b;
        }
        if (b.isZero()) {
            return a;
        }

        double max = Math.max(a.logValue, b.logValue);
        double min = Math.min(a.logValue, b.logValue);
        if (max == Double.POSITIVE_INFINITY) {
            return INFINITY;
        }
        return fromLogValue(max + Math.log1p(Math.exp(min - max)));
    }

    /**
     * Computes {@code a * b}. A zero factor always yields zero, even when the other factor is infinite.
     */
    public static Weight product(Weight a, Weight b) {
        if (a.isZero() || b.isZero()) {
            return ZERO;
        }
        return fromLogValue(a.logValue + b.logValue);
    }

    /**
     * Computes {@code a * b * c}.
     */
    public static Weight product(Weight a, Weight b, Weight c) {
        return product(product(a, b), c);
    }

    /**
     * Computes the product of all given weights, {@link #ONE} for an empty argument list.
     */
    public static Weight product(Weight... weights) {
        Weight result = ONE;
        for (Weight weight : weights) {
            result = product(result, weight);
            if (result.isZero()) {
                return ZERO;
            }
        }
        return result;
    }

    /**
     * Computes {@code 1 / w}.
     *
     * @throws IllegalArgumentException if {@code w} is zero.
     */
    public static Weight inverse(Weight w) {
        if (w.isZero()) {
            throw new IllegalArgumentException("Cannot invert a zero weight");
        }
        return fromLogValue(-w.logValue);
    }

    /**
     * Computes the sum of the geometric series {@code 1 + w + w^2 + ...}.
     *
     * @return {@code 1 / (1 - w)} if {@code w < 1}, {@link #INFINITY} otherwise.
     */
    public static Weight approximateClosure(Weight w) {
        if (w.isZero()) {
            return ONE;
        }
        if (w.logValue >= 0) {
            return INFINITY;
        }
        return fromLogValue(-Math.log1p(-Math.exp(w.logValue)));
    }

    public double getLogValue() {
        return logValue;
    }

    public double getValue() {
        return Math.exp(logValue);
    }

    public boolean isZero() {
        return logValue == Double.NEGATIVE_INFINITY;
    }

    public boolean isInfinity() {
        return logValue == Double.POSITIVE_INFINITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Weight)) return false;
        return Double.compare(logValue, ((Weight) o).logValue) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(logValue);
    }

    @Override
    public String toString() {
        return Double.toString(getValue());
    }
}
