package com.fsmkit.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FsmSpec}.
 */
class FsmSpecTest {

    @Test
    void constructor_keepsTransitionInsertionOrder() {
        Map<Transition, String> transitions = new LinkedHashMap<>();
        transitions.put(new Transition("C", "Z"), "A");
        transitions.put(new Transition("A", "X"), "B");
        transitions.put(new Transition("B", "Y"), "C");

        FsmSpec spec = new FsmSpec(List.of("X", "Y", "Z"), "A", List.of(), "OrderAbciApp",
            List.of("A"), List.of("A", "B", "C"), transitions);

        assertThat(spec.transitionFunc().keySet()).containsExactly(
            new Transition("C", "Z"), new Transition("A", "X"), new Transition("B", "Y"));
    }

    @Test
    void constructor_copiesCollections() {
        List<String> states = new ArrayList<>(List.of("A"));
        Map<Transition, String> transitions = new LinkedHashMap<>();

        FsmSpec spec = new FsmSpec(List.of(), "A", List.of(), "CopyAbciApp", List.of("A"), states, transitions);
        states.add("B");
        transitions.put(new Transition("A", "GO"), "B");

        assertThat(spec.states()).containsExactly("A");
        assertThat(spec.transitionFunc()).isEmpty();
        assertThatThrownBy(() -> spec.transitionFunc().put(new Transition("A", "GO"), "B"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_nullCollections_becomeEmpty() {
        FsmSpec spec = new FsmSpec(null, "A", null, null, null, null, null);

        assertThat(spec.alphabetIn()).isEmpty();
        assertThat(spec.finalStates()).isEmpty();
        assertThat(spec.startStates()).isEmpty();
        assertThat(spec.states()).isEmpty();
        assertThat(spec.transitionFunc()).isEmpty();
    }

    @Test
    void constructor_nullDefaultStartState_throwsException() {
        assertThatThrownBy(() -> new FsmSpec(List.of(), null, List.of(), "X", List.of(), List.of(), Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("defaultStartState");
    }

    @Test
    void constructor_nullTransitionTarget_throwsException() {
        Map<Transition, String> transitions = new LinkedHashMap<>();
        transitions.put(new Transition("A", "GO"), null);

        assertThatThrownBy(() -> new FsmSpec(List.of("GO"), "A", List.of(), "X", List.of("A"),
            List.of("A"), transitions))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("target of Transition[state=A, symbol=GO]");
    }

    @Test
    void withLabel_replacesOnlyLabel() {
        FsmSpec spec = new FsmSpec(List.of("GO"), "A", List.of("B"), "HelloWorldAbciApp",
            List.of("A"), List.of("A", "B"), Map.of(new Transition("A", "GO"), "B"));

        FsmSpec relabelled = spec.withLabel("TraderAbciApp");

        assertThat(relabelled.label()).isEqualTo("TraderAbciApp");
        assertThat(relabelled.withLabel("HelloWorldAbciApp")).isEqualTo(spec);
        assertThat(spec.label()).isEqualTo("HelloWorldAbciApp");
    }

    @Test
    void transition_nullParts_throwException() {
        assertThatThrownBy(() -> new Transition(null, "GO")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Transition("A", null)).isInstanceOf(NullPointerException.class);
    }
}
