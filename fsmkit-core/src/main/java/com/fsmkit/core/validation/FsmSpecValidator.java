package com.fsmkit.core.validation;

import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a spec against the structural invariants of the model.
 *
 * <p>Violations are reported, not thrown, so a caller can list all problems of a
 * hand-written spec at once:
 * <ul>
 *   <li>every transition source and target, start state and final state is declared in {@code states}</li>
 *   <li>the default start state is one of the start states</li>
 *   <li>{@code alphabet_in} is exactly the set of symbols used by transitions</li>
 *   <li>a final state has no outgoing transition</li>
 * </ul>
 */
public class FsmSpecValidator {

    /**
     * Validates a spec.
     *
     * @param spec spec to check
     * @return human readable violations, empty if the spec is consistent
     */
    public List<String> validate(FsmSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        List<String> violations = new ArrayList<>();
        Set<String> states = new LinkedHashSet<>(spec.states());

        if (!spec.startStates().isEmpty() && !spec.startStates().contains(spec.defaultStartState())) {
            violations.add("Default start state '" + spec.defaultStartState() + "' is not a start state");
        }
        requireDeclared(violations, states, List.of(spec.defaultStartState()), "Default start state");
        requireDeclared(violations, states, spec.startStates(), "Start state");
        requireDeclared(violations, states, spec.finalStates(), "Final state");

        Set<String> usedSymbols = new LinkedHashSet<>();
        Set<String> sources = new LinkedHashSet<>();
        for (Map.Entry<Transition, String> entry : spec.transitionFunc().entrySet()) {
            Transition transition = entry.getKey();
            usedSymbols.add(transition.symbol());
            sources.add(transition.state());
            requireDeclared(violations, states, List.of(transition.state()), "Transition source");
            requireDeclared(violations, states, List.of(entry.getValue()), "Transition target");
        }

        Set<String> alphabet = new LinkedHashSet<>(spec.alphabetIn());
        for (String symbol : usedSymbols) {
            if (!alphabet.contains(symbol)) {
                violations.add("Symbol '" + symbol + "' is used by a transition but missing from alphabet_in");
            }
        }
        for (String symbol : alphabet) {
            if (!usedSymbols.contains(symbol)) {
                violations.add("Symbol '" + symbol + "' is declared in alphabet_in but never used");
            }
        }

        for (String finalState : spec.finalStates()) {
            if (sources.contains(finalState)) {
                violations.add("Final state '" + finalState + "' has outgoing transitions");
            }
        }
        return violations;
    }

    private void requireDeclared(List<String> violations, Set<String> states, List<String> names, String role) {
        for (String name : names) {
            if (!states.contains(name)) {
                violations.add(role + " '" + name + "' is not declared in states");
            }
        }
    }
}
