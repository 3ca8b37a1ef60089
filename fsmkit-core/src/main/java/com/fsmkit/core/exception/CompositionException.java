package com.fsmkit.core.exception;

/**
 * Thrown when a set of specs cannot be chained, e.g. because none were given.
 */
public class CompositionException extends FsmSpecException {

    public CompositionException(String message) {
        super(message);
    }
}
