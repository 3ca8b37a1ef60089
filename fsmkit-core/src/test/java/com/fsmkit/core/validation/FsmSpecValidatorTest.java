package com.fsmkit.core.validation;

import com.fsmkit.core.Fixtures;
import com.fsmkit.core.codec.FsmSpecCodec;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import com.fsmkit.core.parser.impl.StateDiagramParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FsmSpecValidator}.
 */
class FsmSpecValidatorTest {

    private FsmSpecValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FsmSpecValidator();
    }

    @Test
    void validate_helloWorldSpec_hasNoViolations() {
        FsmSpec spec = new FsmSpecCodec().decode(Fixtures.read(Fixtures.HELLO_WORLD_YAML));

        assertThat(validator.validate(spec)).isEmpty();
    }

    @Test
    void validate_parsedStateDiagram_hasNoViolations() {
        FsmSpec spec = new StateDiagramParser().parse(Fixtures.read(Fixtures.ARBITRAGE_STATE_DIAGRAM));

        assertThat(validator.validate(spec)).isEmpty();
    }

    @Test
    void validate_undeclaredStates_areReported() {
        FsmSpec spec = new FsmSpec(List.of("GO"), "A", List.of("Z"), "BrokenAbciApp",
            List.of("A"), List.of("A"), Map.of(new Transition("A", "GO"), "B"));

        assertThat(validator.validate(spec))
            .contains("Transition target 'B' is not declared in states")
            .contains("Final state 'Z' is not declared in states");
    }

    @Test
    void validate_alphabetMismatch_isReported() {
        FsmSpec spec = new FsmSpec(List.of("UNUSED"), "A", List.of(), "BrokenAbciApp",
            List.of("A"), List.of("A", "B"), Map.of(new Transition("A", "GO"), "B"));

        assertThat(validator.validate(spec)).containsExactlyInAnyOrder(
            "Symbol 'GO' is used by a transition but missing from alphabet_in",
            "Symbol 'UNUSED' is declared in alphabet_in but never used"
        );
    }

    @Test
    void validate_finalStateWithOutgoingTransition_isReported() {
        FsmSpec spec = new FsmSpec(List.of("GO"), "A", List.of("A"), "BrokenAbciApp",
            List.of("A"), List.of("A", "B"), Map.of(new Transition("A", "GO"), "B"));

        assertThat(validator.validate(spec)).contains("Final state 'A' has outgoing transitions");
    }

    @Test
    void validate_defaultStartNotAmongStartStates_isReported() {
        FsmSpec spec = new FsmSpec(List.of(), "A", List.of(), "BrokenAbciApp",
            List.of("B"), List.of("A", "B"), Map.of());

        assertThat(validator.validate(spec)).containsExactly("Default start state 'A' is not a start state");
    }
}
