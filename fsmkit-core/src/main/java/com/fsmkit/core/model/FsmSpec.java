package com.fsmkit.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured description of a finite state machine.
 *
 * <p>This is the value every component of the compiler works on: the dialect parsers
 * produce it, the {@link com.fsmkit.core.codec.FsmSpecCodec} reads and writes it, the
 * {@link com.fsmkit.core.chain.FsmChainer} composes it and the generators render it.
 *
 * <p>The JSON/YAML property order mirrors the record component order and is part of the
 * serialized contract. {@code transitionFunc} keeps insertion order so that rendering and
 * serialization are reproducible.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * alphabet_in:
 * - DONE
 * - GO
 * default_start_state: A
 * final_states: []
 * label: HelloWorldAbciApp
 * start_states:
 * - A
 * states:
 * - A
 * - B
 * transition_func:
 *   (A, GO): B
 *   (B, DONE): A
 * }</pre>
 *
 * @param alphabetIn unique upper-case input symbols
 * @param defaultStartState the designated start state
 * @param finalStates terminal states
 * @param label free-text identifier chosen by the caller
 * @param startStates start states, the default start state first
 * @param states every declared state, first-seen order
 * @param transitionFunc mapping from (state, symbol) to target state, insertion ordered
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "alphabet_in",
    "default_start_state",
    "final_states",
    "label",
    "start_states",
    "states",
    "transition_func"
})
public record FsmSpec(
    @JsonProperty("alphabet_in") List<String> alphabetIn,
    @JsonProperty("default_start_state") String defaultStartState,
    @JsonProperty("final_states") List<String> finalStates,
    @JsonProperty("label") String label,
    @JsonProperty("start_states") List<String> startStates,
    @JsonProperty("states") List<String> states,
    @JsonProperty("transition_func") Map<Transition, String> transitionFunc
) {
    /**
     * Compact constructor with validation.
     */
    public FsmSpec {
        Objects.requireNonNull(defaultStartState, "defaultStartState must not be null");
        alphabetIn = alphabetIn == null ? List.of() : List.copyOf(alphabetIn);
        finalStates = finalStates == null ? List.of() : List.copyOf(finalStates);
        startStates = startStates == null ? List.of() : List.copyOf(startStates);
        states = states == null ? List.of() : List.copyOf(states);
        transitionFunc = transitionFunc == null ? Map.of() : copyTransitions(transitionFunc);
    }

    // Map.copyOf does not keep insertion order
    private static Map<Transition, String> copyTransitions(Map<Transition, String> source) {
        Map<Transition, String> copy = new LinkedHashMap<>();
        source.forEach((transition, target) -> copy.put(
            Objects.requireNonNull(transition, "transition must not be null"),
            Objects.requireNonNull(target, () -> "target of " + transition + " must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy of this spec carrying a different label.
     *
     * @param newLabel label to use
     * @return relabelled spec
     */
    public FsmSpec withLabel(String newLabel) {
        return new FsmSpec(alphabetIn, defaultStartState, finalStates, newLabel,
            startStates, states, transitionFunc);
    }
}
