package com.fsmkit.core.parser.impl;

import com.fsmkit.core.exception.AmbiguityException;
import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import com.fsmkit.core.parser.Dialect;
import com.fsmkit.core.parser.ParserConfig;
import com.fsmkit.core.parser.StartStateFallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FlowchartParser}.
 */
class FlowchartParserTest {

    private FlowchartParser parser;

    @BeforeEach
    void setUp() {
        parser = new FlowchartParser();
    }

    @Test
    void getDialect_returnsFlowchart() {
        assertThat(parser.getDialect()).isEqualTo(Dialect.FLOWCHART);
    }

    @Test
    void parse_declaredStateAndCycle_buildsSpec() {
        FsmSpec spec = parser.parse("""
            graph TD
            A
            A -->|go| B
            B -->|done| A
            """);

        assertThat(spec.states()).containsExactly("A", "B");
        assertThat(spec.alphabetIn()).containsExactly("DONE", "GO");
        assertThat(spec.transitionFunc()).containsExactly(
            entry(new Transition("A", "GO"), "B"),
            entry(new Transition("B", "DONE"), "A")
        );
        assertThat(spec.defaultStartState()).isEqualTo("A");
        assertThat(spec.startStates()).containsExactly("A");
        assertThat(spec.finalStates()).isEmpty();
        assertThat(spec.label()).isEqualTo(ParserConfig.DEFAULT_LABEL);
    }

    @Test
    void parse_singleZeroInDegreeState_isStartState() {
        FsmSpec spec = parser.parse("""
            graph TD
            Idle -->|start| Running
            Running -->|stop| Stopped
            """);

        assertThat(spec.defaultStartState()).isEqualTo("Idle");
        assertThat(spec.startStates()).containsExactly("Idle");
    }

    @Test
    void parse_targetNeverSource_isFinalState() {
        FsmSpec spec = parser.parse("""
            graph TD
            Idle -->|start| Running
            Running -->|stop| Stopped
            Running -->|fail| Failed
            """);

        assertThat(spec.finalStates()).containsExactly("Stopped", "Failed");
    }

    @Test
    void parse_twoZeroInDegreeStates_throwsAmbiguity() {
        assertThatThrownBy(() -> parser.parse("""
            graph TD
            A -->|go| C
            B -->|go| C
            """))
            .isInstanceOf(AmbiguityException.class)
            .hasMessageContaining("Multiple start states")
            .satisfies(e -> assertThat(((AmbiguityException) e).getCandidates()).containsExactly("A", "B"));
    }

    @Test
    void parse_isolatedDeclaredState_countsAsStartCandidate() {
        assertThatThrownBy(() -> parser.parse("""
            graph TD
            Orphan
            A -->|go| B
            """))
            .isInstanceOf(AmbiguityException.class);
    }

    @Test
    void parse_noZeroInDegreeState_fallsBackToMostFrequent() {
        FsmSpec spec = parser.parse("""
            graph TD
            A -->|go| B
            B -->|back| A
            B -->|loop| B
            """);

        assertThat(spec.defaultStartState()).isEqualTo("B");
    }

    @Test
    void parse_noZeroInDegreeStateTie_prefersFirstSeen() {
        FsmSpec spec = parser.parse("""
            graph TD
            X -->|go| Y
            Y -->|back| X
            """);

        assertThat(spec.defaultStartState()).isEqualTo("X");
    }

    @Test
    void parse_noZeroInDegreeStateWithFailFallback_throwsAmbiguity() {
        FlowchartParser strict = new FlowchartParser(new ParserConfig(StartStateFallback.FAIL, null));

        assertThatThrownBy(() -> strict.parse("""
            graph TD
            A -->|go| B
            B -->|back| A
            """))
            .isInstanceOf(AmbiguityException.class)
            .hasMessageContaining("No start state found")
            .satisfies(e -> assertThat(((AmbiguityException) e).getCandidates()).isEmpty());
    }

    @Test
    void parse_skipsCommentsAndBlankLines() {
        FsmSpec spec = parser.parse("""
            %% leading comment
            graph TD

                %% indented comment
                A -->|go| B
            """);

        assertThat(spec.states()).containsExactly("A", "B");
    }

    @Test
    void parse_linesStartingWithGraph_areSkipped() {
        FsmSpec spec = parser.parse("""
            graphTD
            A -->|go| B
            """);

        assertThat(spec.states()).containsExactly("A", "B");
        assertThat(spec.defaultStartState()).isEqualTo("A");
    }

    @Test
    void parse_duplicateNodeLines_areDeduplicated() {
        FsmSpec spec = parser.parse("""
            graph TD
              A
              A
              B
              A -->|GO| B
            """);

        assertThat(spec.states()).containsExactly("A", "B");
    }

    @Test
    void parse_twoTokenLine_throwsFormatException() {
        assertThatThrownBy(() -> parser.parse("""
            graph TD
            A -->|go|
            """))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("Line 2")
            .hasMessageContaining("2 tokens");
    }

    @Test
    void parse_arrowWithoutLabel_throwsFormatException() {
        assertThatThrownBy(() -> parser.parse("""
            graph TD
            A --> B
            """))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("|label|");
    }

    @Test
    void parse_customDefaultLabel_isApplied() {
        FlowchartParser labelled = new FlowchartParser(new ParserConfig(null, "TraderAbciApp"));

        FsmSpec spec = labelled.parse("A -->|go| B");

        assertThat(spec.label()).isEqualTo("TraderAbciApp");
    }
}
