package com.fsmkit.core.model;

import java.util.Objects;

/**
 * Key of the transition function: the state a transition leaves and the input symbol
 * that triggers it.
 *
 * <p>The textual form {@code "(state, SYMBOL)"} is produced and consumed only by
 * {@link com.fsmkit.core.codec.TransitionKeys}; inside the compiler transitions are
 * always compared as pairs.
 *
 * @param state source state name
 * @param symbol input symbol (upper-case)
 */
public record Transition(
    String state,
    String symbol
) {
    /**
     * Compact constructor with validation.
     */
    public Transition {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(symbol, "symbol must not be null");
    }
}
