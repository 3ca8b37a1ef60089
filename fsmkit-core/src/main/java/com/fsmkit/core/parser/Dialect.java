package com.fsmkit.core.parser;

import com.fsmkit.core.exception.FormatException;

import java.util.List;

/**
 * Textual dialects the compiler can read, identified by their top-level keyword.
 *
 * <ul>
 *   <li>{@link #FLOWCHART} - {@code graph TD} with {@code A -->|label| B} edges</li>
 *   <li>{@link #STATE_DIAGRAM} - {@code stateDiagram-v2} with {@code A --> B: Label} edges
 *       and {@code [*]} pseudostates</li>
 * </ul>
 */
public enum Dialect {

    /** Any line beginning with a keyword is a header, so {@code graphTD} is skipped too. */
    FLOWCHART(List.of("graph", "flowchart"), true),

    STATE_DIAGRAM(List.of("stateDiagram-v2", "stateDiagram"), false);

    private static final String COMMENT_PREFIX = "%%";

    private final List<String> keywords;
    private final boolean prefixHeader;

    Dialect(List<String> keywords, boolean prefixHeader) {
        this.keywords = keywords;
        this.prefixHeader = prefixHeader;
    }

    /**
     * Returns the top-level keywords that introduce this dialect.
     *
     * @return keywords, preferred form first
     */
    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * Checks whether a line is this dialect's header line.
     *
     * @param line stripped input line
     * @return true if the line starts with a keyword (flowchart) or its first token is one
     *         (state diagram)
     */
    public boolean isHeader(String line) {
        if (prefixHeader) {
            return keywords.stream().anyMatch(line::startsWith);
        }
        String first = line.split("\\s+", 2)[0];
        return keywords.contains(first);
    }

    /**
     * Determines the dialect of a text from its first meaningful line.
     *
     * @param text diagram text
     * @return detected dialect
     * @throws FormatException if the text is empty or starts with an unsupported keyword
     */
    public static Dialect sniff(String text) {
        if (text == null) {
            throw new FormatException("Diagram text must not be null");
        }
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            for (Dialect dialect : values()) {
                if (dialect.isHeader(line)) {
                    return dialect;
                }
            }
            throw new FormatException("Unsupported top-level keyword: '" + line.split("\\s+", 2)[0] + "'");
        }
        throw new FormatException("Diagram text is empty");
    }
}
