package com.fsmkit.core.parser;

/**
 * What a parser does when no state has in-degree zero, i.e. every state is the target of
 * some transition.
 */
public enum StartStateFallback {
    /** Pick the state name that occurs most often in the input, first occurrence wins ties */
    MOST_FREQUENT,

    /** Raise {@link com.fsmkit.core.exception.AmbiguityException} */
    FAIL
}
