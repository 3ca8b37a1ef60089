package com.fsmkit.core.parser;

import com.fsmkit.core.model.FsmSpec;

/**
 * Parser for one textual dialect.
 *
 * <p>Implementations are stateless apart from their {@link ParserConfig}; each call to
 * {@link #parse(String)} is independent.
 */
public interface DialectParser {

    /**
     * Returns the dialect this parser reads.
     *
     * @return dialect
     */
    Dialect getDialect();

    /**
     * Parses diagram text into a spec.
     *
     * @param text diagram text, header line optional
     * @return parsed spec carrying the configured placeholder label
     * @throws com.fsmkit.core.exception.FormatException if a line is malformed
     * @throws com.fsmkit.core.exception.AmbiguityException if the start state cannot be inferred
     */
    FsmSpec parse(String text);
}
