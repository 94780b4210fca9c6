package com.kestrel.automata.api.exceptions;

/**
 * Thrown when an automaton would be created with an out-of-range start state
 * or with a transition pointing outside of its state array.
 */
public class InvalidAutomatonStateException extends AutomatonException {

    public InvalidAutomatonStateException(String message) {
        super(message);
    }

    public InvalidAutomatonStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
