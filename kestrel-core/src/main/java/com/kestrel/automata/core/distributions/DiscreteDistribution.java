/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.core.distributions;

import com.kestrel.automata.api.ElementDistribution;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable, normalized distribution over a finite set of elements.
 *
 * <p>Only elements with non-zero probability are stored. Two distributions are
 * equal when they have the same support and the same probabilities.
 *
 * @param <E> Element type
 */
public final class DiscreteDistribution<E> implements ElementDistribution<E, DiscreteDistribution<E>> {

    private final Object2DoubleOpenHashMap<E> probabilities;
    private final int hash;

    private DiscreteDistribution(Object2DoubleOpenHashMap<E> probabilities) {
        this.probabilities = probabilities;
        this.hash = computeHash(probabilities);
    }

    public static <E> DiscreteDistribution<E> pointMass(E element) {
        Objects.requireNonNull(element, "element cannot be null");
        Object2DoubleOpenHashMap<E> map = new Object2DoubleOpenHashMap<>(1);
        map.put(element, 1.0);
        return new DiscreteDistribution<>(map);
    }

    public static <E> DiscreteDistribution<E> uniform(Collection<? extends E> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a uniform distribution over an empty set");
        }
        Object2DoubleOpenHashMap<E> map = new Object2DoubleOpenHashMap<>(elements.size());
        for (E element : elements) {
            map.put(Objects.requireNonNull(element, "element cannot be null"), 1.0);
        }
        return normalized(map);
    }

    /**
     * Creates a distribution from unnormalized, non-negative masses.
     */
    public static <E> DiscreteDistribution<E> fromMasses(Map<? extends E, Double> masses) {
        Object2DoubleOpenHashMap<E> map = new Object2DoubleOpenHashMap<>(masses.size());
        for (Map.Entry<? extends E, Double> entry : masses.entrySet()) {
            double mass = entry.getValue();
            if (mass < 0 || Double.isNaN(mass) || Double.isInfinite(mass)) {
                throw new IllegalArgumentException("Invalid mass for " + entry.getKey() + ": " + mass);
            }
            if (mass > 0) {
                map.put(Objects.requireNonNull(entry.getKey(), "element cannot be null"), mass);
            }
        }
        return normalized(map);
    }

    private static <E> DiscreteDistribution<E> normalized(Object2DoubleOpenHashMap<E> masses) {
        double total = 0;
        for (Object2DoubleMap.Entry<E> entry : masses.object2DoubleEntrySet()) {
            total += entry.getDoubleValue();
        }
        if (!(total > 0)) {
            throw new IllegalArgumentException("Distribution has zero total mass");
        }
        for (Object2DoubleMap.Entry<E> entry : masses.object2DoubleEntrySet()) {
            entry.setValue(entry.getDoubleValue() / total);
        }
        return new DiscreteDistribution<>(masses);
    }

    public double getProb(E element) {
        return probabilities.getDouble(element);
    }

    @Override
    public double getLogProb(E element) {
        return Math.log(probabilities.getDouble(element));
    }

    public int supportSize() {
        return probabilities.size();
    }

    @Override
    public DiscreteDistribution<E> multiply(DiscreteDistribution<E> other) {
        Object2DoubleOpenHashMap<E> product = new Object2DoubleOpenHashMap<>();
        for (Object2DoubleMap.Entry<E> entry : probabilities.object2DoubleEntrySet()) {
            double q = other.probabilities.getDouble(entry.getKey());
            if (q > 0) {
                product.put(entry.getKey(), entry.getDoubleValue() * q);
            }
        }
        return normalized(product);
    }

    @Override
    public DiscreteDistribution<E> weightedSum(double weight1, DiscreteDistribution<E> other, double weight2) {
        if (weight1 < 0 || weight2 < 0 || Double.isNaN(weight1) || Double.isNaN(weight2)) {
            throw new IllegalArgumentException("Mixture weights must be non-negative: " + weight1 + ", " + weight2);
        }
        if (Double.isInfinite(weight1) || Double.isInfinite(weight2)) {
            // Mixing with an infinite weight leaves only the infinite components
            weight1 = Double.isInfinite(weight1) ? 1.0 : 0.0;
            weight2 = Double.isInfinite(weight2) ? 1.0 : 0.0;
        }

        Object2DoubleOpenHashMap<E> mixture = new Object2DoubleOpenHashMap<>(probabilities.size() + other.probabilities.size());
        addScaled(mixture, probabilities, weight1);
        addScaled(mixture, other.probabilities, weight2);
        return normalized(mixture);
    }

    private static <E> void addScaled(Object2DoubleOpenHashMap<E> target, Object2DoubleOpenHashMap<E> source, double scale) {
        if (scale == 0.0) {
            return;
        }
        for (Object2DoubleMap.Entry<E> entry : source.object2DoubleEntrySet()) {
            target.addTo(entry.getKey(), scale * entry.getDoubleValue());
        }
    }

    @Override
    public double getLogAverageOf(DiscreteDistribution<E> other) {
        double sum = 0;
        for (Object2DoubleMap.Entry<E> entry : probabilities.object2DoubleEntrySet()) {
            sum += entry.getDoubleValue() * other.probabilities.getDouble(entry.getKey());
        }
        return Math.log(sum);
    }

    @Override
    public DiscreteDistribution<E> partialUniform() {
        return uniform(probabilities.keySet());
    }

    @Override
    public boolean isPointMass() {
        return probabilities.size() == 1;
    }

    @Override
    public E getPoint() {
        if (!isPointMass()) {
            throw new IllegalStateException("Distribution is not a point mass: " + this);
        }
        return probabilities.keySet().iterator().next();
    }

    private static <E> int computeHash(Object2DoubleOpenHashMap<E> map) {
        int h = 0;
        for (Object2DoubleMap.Entry<E> entry : map.object2DoubleEntrySet()) {
            h += entry.getKey().hashCode() ^ Double.hashCode(entry.getDoubleValue());
        }
        return h;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscreteDistribution)) return false;
        DiscreteDistribution<?> that = (DiscreteDistribution<?>) o;
        if (hash != that.hash || probabilities.size() != that.probabilities.size()) {
            return false;
        }
        for (Object2DoubleMap.Entry<E> entry : probabilities.object2DoubleEntrySet()) {
            @SuppressWarnings("unchecked")
            Object2DoubleOpenHashMap<Object> other = (Object2DoubleOpenHashMap<Object>) that.probabilities;
            if (!other.containsKey(entry.getKey())
                    || Double.compare(other.getDouble(entry.getKey()), entry.getDoubleValue()) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (isPointMass()) {
            return String.valueOf(getPoint());
        }
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Object2DoubleMap.Entry<E> entry : probabilities.object2DoubleEntrySet()) {
            joiner.add(entry.getKey() + "=" + entry.getDoubleValue());
        }
        return joiner.toString();
    }
}
