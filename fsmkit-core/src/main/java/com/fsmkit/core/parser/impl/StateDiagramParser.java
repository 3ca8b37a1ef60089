package com.fsmkit.core.parser.impl;

import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import com.fsmkit.core.parser.Dialect;
import com.fsmkit.core.parser.ParserConfig;
import com.fsmkit.core.parser.base.AbstractLineParser;
import com.fsmkit.core.util.NameUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for the Mermaid state-diagram dialect ({@code stateDiagram-v2}).
 *
 * <p>Edges have the form {@code SOURCE --> TARGET: Label}. The pseudostate {@code [*]}
 * marks an initial state when it is the source and a final state when it is the target;
 * such edges do not enter the transition function.
 *
 * <pre>{@code
 * stateDiagram-v2
 *    [*] --> CheckPositions: Start
 *    CheckPositions --> CheckBalances: Done
 *    CheckBalances --> [*]: Done
 * }</pre>
 *
 * <p>Labels are converted to UPPER_SNAKE_CASE ({@code NoAction} becomes {@code NO_ACTION}).
 * Several initial states are allowed; the first one is the default start state. Without
 * any {@code [*]} initial edge the start state is inferred like in the flowchart dialect.
 */
public class StateDiagramParser extends AbstractLineParser {

    static final String PSEUDOSTATE = "[*]";

    private static final String ARROW = "-->";
    private static final String LABEL_SEPARATOR = ":";

    public StateDiagramParser(ParserConfig config) {
        super(config);
    }

    public StateDiagramParser() {
        this(ParserConfig.defaults());
    }

    @Override
    public Dialect getDialect() {
        return Dialect.STATE_DIAGRAM;
    }

    @Override
    public FsmSpec parse(String text) {
        Set<String> states = new LinkedHashSet<>();
        Set<String> initialStates = new LinkedHashSet<>();
        Set<String> explicitFinals = new LinkedHashSet<>();
        Map<Transition, String> transitions = new LinkedHashMap<>();
        Map<String, Integer> occurrences = newOccurrenceCounter();

        for (SourceLine line : meaningfulLines(text)) {
            int separator = line.text().indexOf(LABEL_SEPARATOR);
            String edge = separator < 0 ? line.text() : line.text().substring(0, separator);
            String label = separator < 0 ? "" : line.text().substring(separator + 1).strip();

            String[] tokens = tokenize(edge.strip());
            if (tokens.length != 3 || !ARROW.equals(tokens[1])) {
                throw FormatException.atLine(line.number(), line.text(),
                    "expected 'SOURCE --> TARGET: Label'");
            }
            String source = tokens[0];
            String target = tokens[2];

            if (PSEUDOSTATE.equals(source) && PSEUDOSTATE.equals(target)) {
                throw FormatException.atLine(line.number(), line.text(), "edge between two pseudostates");
            }
            if (PSEUDOSTATE.equals(source)) {
                initialStates.add(target);
                states.add(target);
                countOccurrence(occurrences, target);
                continue;
            }
            if (PSEUDOSTATE.equals(target)) {
                explicitFinals.add(source);
                states.add(source);
                countOccurrence(occurrences, source);
                continue;
            }
            if (label.isEmpty()) {
                throw FormatException.atLine(line.number(), line.text(), "transition is missing its ': Label'");
            }

            transitions.put(new Transition(source, NameUtils.toUpperSnake(label)), target);
            states.add(source);
            states.add(target);
            countOccurrence(occurrences, source);
            countOccurrence(occurrences, target);
        }

        List<String> startStates = initialStates.isEmpty()
            ? List.of(inferStartState(states, transitions, occurrences))
            : List.copyOf(initialStates);

        Set<String> finals = new LinkedHashSet<>(explicitFinals);
        finals.addAll(inferFinalStates(states, transitions));

        log.debug("Parsed state diagram: {} states, {} transitions, start states {}",
            states.size(), transitions.size(), startStates);

        return new FsmSpec(
            alphabetOf(transitions),
            startStates.get(0),
            new ArrayList<>(finals),
            config.defaultLabel(),
            startStates,
            List.copyOf(states),
            transitions
        );
    }
}
