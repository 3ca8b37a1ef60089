package com.fsmkit.core.generator.impl;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fsmkit.core.generator.GeneratedDiagram;
import com.fsmkit.core.generator.SpecGenerator;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;

/**
 * Renders an {@link FsmSpec} as a Mermaid flowchart.
 *
 * <p>The output is the flowchart dialect read by
 * {@link com.fsmkit.core.parser.impl.FlowchartParser}, so rendering and parsing round-trip:
 *
 * <pre>{@code
 * graph TD
 *   A
 *   A
 *   B
 *   A -->|GO| B
 *   B -->|DONE| A
 * }</pre>
 *
 * <p>The default start state is written first and then again among the declared states.
 * Transitions are written in insertion order.
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart Syntax</a>
 */
public class MermaidGenerator implements SpecGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "mmd";

    private static final String GRAPH_TD = "graph TD\n";
    private static final String INDENT = "  ";
    private static final String NEWLINE = "\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(FsmSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        StringBuilder sb = new StringBuilder(GRAPH_TD);
        appendNode(sb, spec.defaultStartState());
        for (String state : spec.states()) {
            appendNode(sb, state);
        }
        for (Map.Entry<Transition, String> entry : spec.transitionFunc().entrySet()) {
            appendEdge(sb, entry.getKey(), entry.getValue());
        }

        log.debug("Rendered {} states and {} transitions as Mermaid flowchart",
            spec.states().size(), spec.transitionFunc().size());

        return new GeneratedDiagram(nameOf(spec), sb.toString(), FILE_EXTENSION);
    }

    /**
     * Appends a bare node line.
     *
     * @param sb the string builder
     * @param state state name
     */
    private void appendNode(StringBuilder sb, String state) {
        sb.append(INDENT).append(state).append(NEWLINE);
    }

    /**
     * Appends an edge line {@code SOURCE -->|SYMBOL| TARGET}.
     *
     * @param sb the string builder
     * @param transition source state and symbol
     * @param target target state
     */
    private void appendEdge(StringBuilder sb, Transition transition, String target) {
        sb.append(INDENT).append(transition.state())
            .append(" -->|").append(transition.symbol()).append("| ")
            .append(target).append(NEWLINE);
    }

    static String nameOf(FsmSpec spec) {
        return spec.label() != null ? spec.label() : "fsm";
    }
}
