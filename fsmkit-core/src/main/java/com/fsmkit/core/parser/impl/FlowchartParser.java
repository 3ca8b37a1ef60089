package com.fsmkit.core.parser.impl;

import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import com.fsmkit.core.parser.Dialect;
import com.fsmkit.core.parser.ParserConfig;
import com.fsmkit.core.parser.base.AbstractLineParser;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parser for the Mermaid flowchart dialect ({@code graph TD}).
 *
 * <p>Every meaningful line is either a single state name, declaring the state, or an
 * edge of exactly three tokens whose arrow embeds a pipe-delimited label:
 *
 * <pre>{@code
 * graph TD
 * A
 * A -->|go| B
 * B -->|done| A
 * }</pre>
 *
 * <p>The label is upper-cased to become the input symbol. Only one start state is
 * supported; it is inferred from in-degree analysis.
 */
public class FlowchartParser extends AbstractLineParser {

    private static final String LABEL_DELIMITER = "|";

    public FlowchartParser(ParserConfig config) {
        super(config);
    }

    public FlowchartParser() {
        this(ParserConfig.defaults());
    }

    @Override
    public Dialect getDialect() {
        return Dialect.FLOWCHART;
    }

    @Override
    public FsmSpec parse(String text) {
        Set<String> states = new LinkedHashSet<>();
        Map<Transition, String> transitions = new LinkedHashMap<>();
        Map<String, Integer> occurrences = newOccurrenceCounter();

        for (SourceLine line : meaningfulLines(text)) {
            String[] tokens = tokenize(line.text());
            switch (tokens.length) {
                case 1 -> {
                    states.add(tokens[0]);
                    countOccurrence(occurrences, tokens[0]);
                }
                case 3 -> {
                    String source = tokens[0];
                    String target = tokens[2];
                    String symbol = extractSymbol(line, tokens[1]);
                    transitions.put(new Transition(source, symbol), target);
                    states.add(source);
                    states.add(target);
                    countOccurrence(occurrences, source);
                    countOccurrence(occurrences, target);
                }
                default -> throw FormatException.atLine(line.number(), line.text(),
                    "expected a state or 'SOURCE -->|label| TARGET', got " + tokens.length + " tokens");
            }
        }

        String start = inferStartState(states, transitions, occurrences);
        List<String> finals = inferFinalStates(states, transitions);

        log.debug("Parsed flowchart: {} states, {} transitions, start state {}",
            states.size(), transitions.size(), start);

        return new FsmSpec(
            alphabetOf(transitions),
            start,
            finals,
            config.defaultLabel(),
            List.of(start),
            List.copyOf(states),
            transitions
        );
    }

    private String extractSymbol(SourceLine line, String arrow) {
        String[] parts = arrow.split("\\" + LABEL_DELIMITER, -1);
        if (parts.length < 3 || parts[1].isBlank()) {
            throw FormatException.atLine(line.number(), line.text(), "arrow must carry a '|label|'");
        }
        return parts[1].toUpperCase(Locale.ROOT);
    }
}
