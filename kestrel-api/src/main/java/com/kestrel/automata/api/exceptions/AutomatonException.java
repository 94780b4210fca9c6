/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.api.exceptions;

/**
 * Base class for failures raised by automaton operations.
 *
 * This is a RuntimeException so that graph traversals and builder chains
 * are not cluttered with checked exception handling.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }

    public AutomatonException(Throwable cause) {
        super(cause);
    }
}
