package com.kestrel.automata.core.model;

import com.kestrel.automata.core.distributions.DiscreteDistribution;
import com.kestrel.automata.core.distributions.ListManipulator;
import com.kestrel.automata.core.distributions.StringManipulator;

import java.util.List;

/**
 * Ready-made alphabets backed by {@link DiscreteDistribution}.
 */
public final class Alphabets {

    private static final Alphabet<String, Character, DiscreteDistribution<Character>> STRINGS =
            new Alphabet<String, Character, DiscreteDistribution<Character>>(
                    StringManipulator.INSTANCE, DiscreteDistribution::pointMass);

    private Alphabets() {
    }

    /** Automata over {@code String}s of {@code Character}s. */
    public static Alphabet<String, Character, DiscreteDistribution<Character>> strings() {
        return STRINGS;
    }

    /** Automata over {@code List}s of arbitrary elements. */
    public static <E> Alphabet<List<E>, E, DiscreteDistribution<E>> lists() {
        return new Alphabet<List<E>, E, DiscreteDistribution<E>>(
                new ListManipulator<E>(), DiscreteDistribution::pointMass);
    }
}
