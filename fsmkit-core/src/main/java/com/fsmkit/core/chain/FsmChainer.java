package com.fsmkit.core.chain;

import com.fsmkit.core.exception.CompositionException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Composes an ordered list of specs into one spec that runs them in sequence.
 *
 * <p>The chained spec holds the union of all states, symbols and transitions. Each final
 * state of a component is bridged to every start state of the next component with a
 * synthetic {@value #BRIDGE_SYMBOL} transition. Start states come from the first
 * component, final states from the last.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FsmSpec chained = new FsmChainer().chain(List.of(registration, trading, resetAndPause));
 * }</pre>
 */
public class FsmChainer {

    /** Symbol of the transitions linking one component to the next */
    public static final String BRIDGE_SYMBOL = "DONE";

    private static final Logger log = LoggerFactory.getLogger(FsmChainer.class);

    private final String label;

    /**
     * Creates a chainer labelling its output {@code ChainedFSM}.
     */
    public FsmChainer() {
        this("ChainedFSM");
    }

    /**
     * Creates a chainer with a custom output label.
     *
     * @param label label of chained specs
     */
    public FsmChainer(String label) {
        this.label = label;
    }

    /**
     * Chains the specs in the given order.
     *
     * @param fsms specs to chain, first one is entered first
     * @return the chained spec
     * @throws CompositionException if the list is null or empty
     */
    public FsmSpec chain(List<FsmSpec> fsms) {
        if (fsms == null || fsms.isEmpty()) {
            throw new CompositionException("At least one FSM spec is required for chaining");
        }
        validate(fsms);

        Set<String> states = new LinkedHashSet<>();
        Set<String> alphabet = new TreeSet<>();
        Map<Transition, String> transitions = new LinkedHashMap<>();
        alphabet.add(BRIDGE_SYMBOL);

        for (int i = 0; i < fsms.size(); i++) {
            FsmSpec fsm = fsms.get(i);
            states.addAll(fsm.states());
            alphabet.addAll(fsm.alphabetIn());
            for (Transition transition : fsm.transitionFunc().keySet()) {
                alphabet.add(transition.symbol());
            }
            transitions.putAll(fsm.transitionFunc());

            if (i > 0) {
                bridge(fsms.get(i - 1), fsm, transitions);
            }
        }

        FsmSpec first = fsms.get(0);
        FsmSpec last = fsms.get(fsms.size() - 1);

        log.info("Chained {} FSM specs into '{}': {} states, {} transitions",
            fsms.size(), label, states.size(), transitions.size());

        return new FsmSpec(
            List.copyOf(alphabet),
            first.defaultStartState(),
            last.finalStates(),
            label,
            first.startStates(),
            List.copyOf(states),
            transitions
        );
    }

    /**
     * Extension point run before chaining. Performs no checks; subclasses may reject
     * inputs by throwing {@link CompositionException}.
     *
     * @param fsms the non-empty list of specs about to be chained
     */
    protected void validate(List<FsmSpec> fsms) {
        log.debug("Chaining {} FSM specs", fsms.size());
    }

    private void bridge(FsmSpec previous, FsmSpec next, Map<Transition, String> transitions) {
        for (String finalState : previous.finalStates()) {
            for (String startState : next.startStates()) {
                transitions.put(new Transition(finalState, BRIDGE_SYMBOL), startState);
                log.debug("Bridged {} -> {} on {}", finalState, startState, BRIDGE_SYMBOL);
            }
        }
    }
}
