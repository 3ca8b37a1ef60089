package com.fsmkit.core.exception;

/**
 * Thrown when text does not have the shape a dialect or the YAML codec expects:
 * a malformed line, an unsupported top-level keyword or an unreadable document.
 */
public class FormatException extends FsmSpecException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception pointing at an offending input line.
     *
     * @param lineNumber 1-based line number
     * @param line the raw line
     * @param reason what is wrong with it
     * @return the exception
     */
    public static FormatException atLine(int lineNumber, String line, String reason) {
        return new FormatException("Line " + lineNumber + ": " + reason + ": '" + line.strip() + "'");
    }
}
