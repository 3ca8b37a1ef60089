package com.fsmkit.core.exception;

/**
 * Base class of every failure raised while parsing, rendering, encoding or chaining
 * FSM specifications.
 *
 * <p>All operations of the compiler are pure transformations, so these exceptions are
 * never retried; callers either fix the input or report the message.
 */
public class FsmSpecException extends RuntimeException {

    public FsmSpecException(String message) {
        super(message);
    }

    public FsmSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
