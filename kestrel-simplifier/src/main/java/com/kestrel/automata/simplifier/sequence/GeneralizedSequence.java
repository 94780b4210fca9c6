package com.kestrel.automata.simplifier.sequence;

import com.kestrel.automata.api.ElementDistribution;

import java.util.List;

/**
 * Immutable sequence of generalized elements extracted from a tree-shaped
 * region of an automaton.
 */
public final class GeneralizedSequence<E, D extends ElementDistribution<E, D>> {

    private final List<GeneralizedElement<E, D>> elements;

    public GeneralizedSequence(List<GeneralizedElement<E, D>> elements) {
        this.elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public GeneralizedElement<E, D> get(int index) {
        return elements.get(index);
    }

    public List<GeneralizedElement<E, D>> getElements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeneralizedSequence)) return false;
        return elements.equals(((GeneralizedSequence<?, ?>) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (GeneralizedElement<E, D> element : elements) {
            sb.append(element);
        }
        return sb.toString();
    }
}
