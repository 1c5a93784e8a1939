package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * One edge of a state machine.
 *
 * @param fromState      Source state, or {@code *} for any state
 * @param toState        Target state
 * @param guards         Guards that must all pass, in declaration order
 * @param autoTransition Time-based trigger, null for manual-only transitions
 */
public record Transition(
        String fromState,
        String toState,
        List<Guard> guards,
        AutoTransitionSpec autoTransition) {

    public static final String WILDCARD = "*";

    public Transition {
        Objects.requireNonNull(fromState, "From state cannot be null");
        Objects.requireNonNull(toState, "To state cannot be null");
        guards = guards == null ? List.of() : List.copyOf(guards);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(fromState);
    }

    public boolean isAuto() {
        return autoTransition != null;
    }

    public boolean matches(String from, String to) {
        return toState.equals(to) && (isWildcard() || fromState.equals(from));
    }
}
