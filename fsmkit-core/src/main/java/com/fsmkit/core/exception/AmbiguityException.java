package com.fsmkit.core.exception;

import java.util.List;

/**
 * Thrown when the start state cannot be inferred unambiguously from in-degree analysis.
 */
public class AmbiguityException extends FsmSpecException {

    private final List<String> candidates;

    public AmbiguityException(String message, List<String> candidates) {
        super(message);
        this.candidates = List.copyOf(candidates);
    }

    /**
     * Returns the states that qualified as start state.
     *
     * @return candidate states, empty when no state qualified
     */
    public List<String> getCandidates() {
        return candidates;
    }
}
