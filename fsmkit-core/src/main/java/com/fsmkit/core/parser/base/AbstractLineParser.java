package com.fsmkit.core.parser.base;

import com.fsmkit.core.exception.AmbiguityException;
import com.fsmkit.core.model.Transition;
import com.fsmkit.core.parser.Dialect;
import com.fsmkit.core.parser.DialectParser;
import com.fsmkit.core.parser.ParserConfig;
import com.fsmkit.core.parser.StartStateFallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Abstract base class for line-oriented diagram parsers.
 *
 * <p>Both Mermaid dialects are read one line at a time and share the same inference rules
 * for start and final states. This class provides:
 * <ul>
 *   <li>Line splitting with blank, comment and header lines filtered out</li>
 *   <li>Whitespace tokenization</li>
 *   <li>Start-state inference by in-degree, with the configured fallback</li>
 *   <li>Final-state inference (targets that are never sources)</li>
 * </ul>
 *
 * @see com.fsmkit.core.parser.impl.FlowchartParser
 * @see com.fsmkit.core.parser.impl.StateDiagramParser
 */
public abstract class AbstractLineParser implements DialectParser {

    private static final String COMMENT_PREFIX = "%%";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    protected final Logger log;
    protected final ParserConfig config;

    /**
     * Creates a parser with the given configuration.
     *
     * @param config parser configuration
     */
    protected AbstractLineParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * A meaningful input line with its 1-based position.
     *
     * @param number line number
     * @param text stripped line text
     */
    protected record SourceLine(int number, String text) {}

    // ==================== Line Handling ====================

    /**
     * Splits text into lines, dropping blank lines, {@code %%} comments and this
     * dialect's header line.
     *
     * @param text diagram text
     * @return meaningful lines in input order
     */
    protected List<SourceLine> meaningfulLines(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Dialect dialect = getDialect();
        List<SourceLine> lines = new ArrayList<>();
        String[] raw = LINE_BREAK.split(text);
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i].strip();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX) || dialect.isHeader(line)) {
                continue;
            }
            lines.add(new SourceLine(i + 1, line));
        }
        return lines;
    }

    /**
     * Splits a line on whitespace.
     *
     * @param line stripped line
     * @return tokens
     */
    protected String[] tokenize(String line) {
        return WHITESPACE.split(line);
    }

    // ==================== Inference ====================

    /**
     * Collects the sorted set of symbols used by the transitions.
     *
     * @param transitions transition function
     * @return sorted unique symbols
     */
    protected List<String> alphabetOf(Map<Transition, String> transitions) {
        Set<String> symbols = new TreeSet<>();
        for (Transition transition : transitions.keySet()) {
            symbols.add(transition.symbol());
        }
        return List.copyOf(symbols);
    }

    /**
     * Returns the states that are never the target of a transition.
     *
     * @param states all states in first-seen order
     * @param transitions transition function
     * @return start-state candidates in first-seen order
     */
    protected List<String> startCandidates(Collection<String> states, Map<Transition, String> transitions) {
        Set<String> targets = new LinkedHashSet<>(transitions.values());
        return states.stream()
            .filter(state -> !targets.contains(state))
            .toList();
    }

    /**
     * Infers the single start state.
     *
     * <p>Exactly one in-degree-zero state is required. With none, the configured
     * {@link StartStateFallback} decides; with several, the input is ambiguous.
     *
     * @param states all states in first-seen order
     * @param transitions transition function
     * @param occurrences how often each state name occurs in the input, first-seen order
     * @return the start state
     * @throws AmbiguityException if zero (with {@link StartStateFallback#FAIL}) or several candidates exist
     */
    protected String inferStartState(Collection<String> states,
                                     Map<Transition, String> transitions,
                                     Map<String, Integer> occurrences) {
        List<String> candidates = startCandidates(states, transitions);
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (candidates.size() > 1) {
            throw new AmbiguityException(
                "Multiple start states are not supported, found candidates: " + candidates, candidates);
        }
        if (config.startStateFallback() == StartStateFallback.FAIL || occurrences.isEmpty()) {
            throw new AmbiguityException(
                "No start state found: every state is the target of a transition", List.of());
        }
        String start = mostFrequent(occurrences);
        log.warn("No state with in-degree zero, falling back to most frequent state: {}", start);
        return start;
    }

    /**
     * Infers final states: states that are a transition target and never a transition source.
     *
     * @param states all states in first-seen order
     * @param transitions transition function
     * @return final states in first-seen order
     */
    protected List<String> inferFinalStates(Collection<String> states, Map<Transition, String> transitions) {
        Set<String> sources = new LinkedHashSet<>();
        for (Transition transition : transitions.keySet()) {
            sources.add(transition.state());
        }
        Set<String> targets = new LinkedHashSet<>(transitions.values());
        return states.stream()
            .filter(state -> targets.contains(state) && !sources.contains(state))
            .toList();
    }

    /**
     * Counts one more occurrence of a state name.
     *
     * @param occurrences running counts, insertion ordered
     * @param state state name
     */
    protected static void countOccurrence(Map<String, Integer> occurrences, String state) {
        occurrences.merge(state, 1, Integer::sum);
    }

    private static String mostFrequent(Map<String, Integer> occurrences) {
        String best = null;
        int bestCount = 0;
        // strict comparison keeps the first-seen name on ties
        for (Map.Entry<String, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Creates an empty insertion-ordered occurrence counter.
     *
     * @return counter map
     */
    protected static Map<String, Integer> newOccurrenceCounter() {
        return new LinkedHashMap<>();
    }
}
