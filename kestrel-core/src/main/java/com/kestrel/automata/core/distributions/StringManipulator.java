package com.kestrel.automata.core.distributions;

import com.kestrel.automata.api.SequenceManipulator;

import java.util.List;

public final class StringManipulator implements SequenceManipulator<String, Character> {

    public static final StringManipulator INSTANCE = new StringManipulator();

    private StringManipulator() {
    }

    @Override
    public int length(String sequence) {
        return sequence.length();
    }

    @Override
    public Character elementAt(String sequence, int index) {
        return sequence.charAt(index);
    }

    @Override
    public String toSequence(List<Character> elements) {
        StringBuilder sb = new StringBuilder(elements.size());
        for (Character c : elements) {
            sb.append(c.charValue());
        }
        return sb.toString();
    }
}
