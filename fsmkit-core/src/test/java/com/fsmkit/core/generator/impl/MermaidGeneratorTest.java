package com.fsmkit.core.generator.impl;

import com.fsmkit.core.Fixtures;
import com.fsmkit.core.codec.FsmSpecCodec;
import com.fsmkit.core.generator.GeneratedDiagram;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.parser.impl.FlowchartParser;
import com.fsmkit.core.parser.impl.StateDiagramParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private FlowchartParser parser;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        parser = new FlowchartParser();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
    }

    @Test
    void getFileExtension_returnsMmd() {
        assertThat(generator.getFileExtension()).isEqualTo("mmd");
    }

    @Test
    void generate_withNullSpec_throwsException() {
        assertThatThrownBy(() -> generator.generate(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_helloWorldSpec_writesStartStatesAndTransitionsInOrder() {
        FsmSpec spec = new FsmSpecCodec().decode(Fixtures.read(Fixtures.HELLO_WORLD_YAML));

        GeneratedDiagram diagram = generator.generate(spec);

        assertThat(diagram.name()).isEqualTo("HelloWorldAbciApp");
        assertThat(diagram.fileExtension()).isEqualTo("mmd");
        assertThat(diagram.content()).isEqualTo("""
            graph TD
              RegistrationRound
              RegistrationRound
              CollectRandomnessRound
              PrintMessageRound
              ResetAndPauseRound
              SelectKeeperRound
              CollectRandomnessRound -->|DONE| SelectKeeperRound
              CollectRandomnessRound -->|NO_MAJORITY| CollectRandomnessRound
              CollectRandomnessRound -->|ROUND_TIMEOUT| CollectRandomnessRound
              PrintMessageRound -->|DONE| ResetAndPauseRound
              PrintMessageRound -->|ROUND_TIMEOUT| RegistrationRound
              RegistrationRound -->|DONE| CollectRandomnessRound
              ResetAndPauseRound -->|DONE| CollectRandomnessRound
              ResetAndPauseRound -->|NO_MAJORITY| RegistrationRound
              ResetAndPauseRound -->|RESET_TIMEOUT| RegistrationRound
              SelectKeeperRound -->|DONE| PrintMessageRound
              SelectKeeperRound -->|NO_MAJORITY| RegistrationRound
              SelectKeeperRound -->|ROUND_TIMEOUT| RegistrationRound
            """);
    }

    @Test
    void generate_thenParse_reproducesYamlSpec() {
        FsmSpec original = new FsmSpecCodec().decode(Fixtures.read(Fixtures.HELLO_WORLD_YAML));

        FsmSpec reparsed = parser.parse(generator.generate(original).content());

        assertThat(reparsed.defaultStartState()).isEqualTo(original.defaultStartState());
        assertThat(reparsed.states()).containsExactlyInAnyOrderElementsOf(original.states());
        assertThat(reparsed.alphabetIn()).containsExactlyInAnyOrderElementsOf(original.alphabetIn());
        assertThat(reparsed.transitionFunc()).isEqualTo(original.transitionFunc());
    }

    @Test
    void generate_thenParse_reproducesFlowchartSpec() {
        FsmSpec original = parser.parse("""
            graph TD
            Idle -->|start| Running
            Running -->|tick| Running
            Running -->|stop| Stopped
            """);

        FsmSpec reparsed = parser.parse(generator.generate(original).content());

        assertThat(reparsed.states()).containsExactlyElementsOf(original.states());
        assertThat(reparsed.alphabetIn()).containsExactlyElementsOf(original.alphabetIn());
        assertThat(reparsed.transitionFunc()).containsExactlyEntriesOf(original.transitionFunc());
        assertThat(reparsed.defaultStartState()).isEqualTo("Idle");
        assertThat(reparsed.finalStates()).containsExactly("Stopped");
    }

    @Test
    void generate_thenParse_reproducesStateDiagramSpec() {
        FsmSpec original = new StateDiagramParser().parse(Fixtures.read(Fixtures.ARBITRAGE_STATE_DIAGRAM));

        FsmSpec reparsed = parser.parse(generator.generate(original).content());

        assertThat(reparsed.defaultStartState()).isEqualTo(original.defaultStartState());
        assertThat(reparsed.states()).containsExactlyInAnyOrderElementsOf(original.states());
        assertThat(reparsed.alphabetIn()).containsExactlyElementsOf(original.alphabetIn());
        assertThat(reparsed.transitionFunc()).containsExactlyEntriesOf(original.transitionFunc());
    }
}
