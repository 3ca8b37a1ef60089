package com.fsmkit.core.codec;

import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.model.Transition;

/**
 * Adapter between {@link Transition} and its textual key form {@code "(state, SYMBOL)"}.
 *
 * <p>Only the YAML codec uses this class. Everything else works on the {@link Transition}
 * pair directly.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String key = TransitionKeys.format(new Transition("A", "GO"));  // "(A, GO)"
 * Transition transition = TransitionKeys.parse("(A, GO)");
 * }</pre>
 */
public final class TransitionKeys {

    private static final String OPEN = "(";
    private static final String CLOSE = ")";
    private static final String SEPARATOR = ", ";

    private TransitionKeys() {
        // Utility class
    }

    /**
     * Formats a transition as a key string.
     *
     * @param transition transition to format
     * @return key in the form {@code "(state, SYMBOL)"}
     */
    public static String format(Transition transition) {
        return OPEN + transition.state() + SEPARATOR + transition.symbol() + CLOSE;
    }

    /**
     * Parses a key string back into a transition.
     *
     * <p>Strips the surrounding parentheses and splits on {@code ", "}.
     *
     * @param key key in the form {@code "(state, SYMBOL)"}
     * @return parsed transition
     * @throws FormatException if the key does not follow the grammar
     */
    public static Transition parse(String key) {
        if (key == null) {
            throw new FormatException("Transition key must not be null");
        }
        String trimmed = key.strip();
        if (!trimmed.startsWith(OPEN) || !trimmed.endsWith(CLOSE)) {
            throw new FormatException("Transition key must be enclosed in parentheses: '" + key + "'");
        }
        String inner = trimmed.substring(1, trimmed.length() - 1);
        String[] parts = inner.split(SEPARATOR, -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new FormatException("Transition key must be '(state, SYMBOL)': '" + key + "'");
        }
        return new Transition(parts[0], parts[1]);
    }
}
