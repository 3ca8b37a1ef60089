package com.fsmkit.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for converting state and symbol names between naming conventions.
 */
public final class NameUtils {

    // "newValue" -> "new_Value", "HTTPServer" -> "HTTP_Server"
    private static final Pattern LOWER_UPPER_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");

    private NameUtils() {
        // Utility class
    }

    /**
     * Converts a camel-case or mixed-case name to UPPER_SNAKE_CASE.
     *
     * <p>Names that are already upper-case pass through unchanged. Whitespace and hyphens
     * become underscores.
     *
     * <pre>{@code
     * toUpperSnake("NewExpiredPositionFound") // "NEW_EXPIRED_POSITION_FOUND"
     * toUpperSnake("Done")                    // "DONE"
     * toUpperSnake("ROUND_TIMEOUT")           // "ROUND_TIMEOUT"
     * }</pre>
     *
     * @param name name to convert
     * @return upper snake case name
     */
    public static String toUpperSnake(String name) {
        String trimmed = name.strip();
        if (trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
            return SEPARATORS.matcher(trimmed).replaceAll("_");
        }
        String result = SEPARATORS.matcher(trimmed).replaceAll("_");
        result = ACRONYM_BOUNDARY.matcher(result).replaceAll("$1_$2");
        result = LOWER_UPPER_BOUNDARY.matcher(result).replaceAll("$1_$2");
        result = REPEATED_UNDERSCORES.matcher(result).replaceAll("_");
        return result.toUpperCase(Locale.ROOT);
    }
}
