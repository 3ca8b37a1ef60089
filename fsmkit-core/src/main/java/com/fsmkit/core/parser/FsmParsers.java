package com.fsmkit.core.parser;

import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.parser.impl.FlowchartParser;
import com.fsmkit.core.parser.impl.StateDiagramParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for parsing diagram text of either dialect.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FsmSpec spec = FsmParsers.parse("""
 *     graph TD
 *     A -->|go| B
 *     """).withLabel("MyAbciApp");
 * }</pre>
 */
public final class FsmParsers {

    private static final Logger log = LoggerFactory.getLogger(FsmParsers.class);

    private FsmParsers() {
        // Utility class
    }

    /**
     * Returns the parser for a dialect.
     *
     * @param dialect dialect to parse
     * @param config parser configuration
     * @return parser instance
     */
    public static DialectParser parserFor(Dialect dialect, ParserConfig config) {
        Objects.requireNonNull(dialect, "dialect must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return switch (dialect) {
            case FLOWCHART -> new FlowchartParser(config);
            case STATE_DIAGRAM -> new StateDiagramParser(config);
        };
    }

    /**
     * Parses diagram text with the default configuration.
     *
     * @param text diagram text starting with a dialect keyword
     * @return parsed spec
     */
    public static FsmSpec parse(String text) {
        return parse(text, ParserConfig.defaults());
    }

    /**
     * Detects the dialect of the text and parses it.
     *
     * @param text diagram text starting with a dialect keyword
     * @param config parser configuration
     * @return parsed spec
     * @throws com.fsmkit.core.exception.FormatException if the keyword is unsupported or a line is malformed
     * @throws com.fsmkit.core.exception.AmbiguityException if the start state cannot be inferred
     */
    public static FsmSpec parse(String text, ParserConfig config) {
        Dialect dialect = Dialect.sniff(text);
        log.debug("Detected dialect: {}", dialect);
        return parserFor(dialect, config).parse(text);
    }
}
