package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An entity's lifecycle: the enum {@code status} field, its states, and the
 * transitions between them.
 *
 * @param statusField The field holding the current state
 * @param states      The legal states, in declaration order
 * @param transitions The transitions, in declaration order
 */
public record StateMachine(String statusField, List<String> states, List<Transition> transitions) {

    public StateMachine {
        Objects.requireNonNull(statusField, "Status field cannot be null");
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
    }

    /**
     * Finds the transition for a state change. An exact from-state match
     * wins over a wildcard.
     */
    public Optional<Transition> findTransition(String from, String to) {
        Transition wildcard = null;
        for (Transition transition : transitions) {
            if (transition.matches(from, to)) {
                if (!transition.isWildcard()) {
                    return Optional.of(transition);
                }
                if (wildcard == null) {
                    wildcard = transition;
                }
            }
        }
        return Optional.ofNullable(wildcard);
    }

    public List<Transition> transitionsFrom(String from) {
        return transitions.stream()
                .filter(t -> t.isWildcard() || t.fromState().equals(from))
                .toList();
    }
}
