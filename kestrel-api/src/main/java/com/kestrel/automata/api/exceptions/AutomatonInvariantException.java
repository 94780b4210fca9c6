package com.kestrel.automata.api.exceptions;

/**
 * Signals that an internal consistency check failed, e.g. a tombstone counter
 * that no longer matches the arena or an insertion that was required to succeed.
 * Seeing this exception always indicates a bug rather than bad input.
 */
public class AutomatonInvariantException extends AutomatonException {

    public AutomatonInvariantException(String message) {
        super(message);
    }
}
