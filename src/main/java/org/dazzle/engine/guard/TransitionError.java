package org.dazzle.engine.guard;

import java.util.List;

/**
 * Why a state change was refused.
 */
public sealed interface TransitionError permits TransitionError.InvalidTransition, TransitionError.GuardNotSatisfied {

    String message();

    /**
     * No transition leads from the current state to the requested one.
     *
     * @param fromState     The current state, null for a record without one
     * @param toState       The requested state
     * @param allowedStates States reachable from {@code fromState}
     */
    record InvalidTransition(String fromState, String toState, List<String> allowedStates) implements TransitionError {

        public InvalidTransition {
            allowedStates = List.copyOf(allowedStates);
        }

        @Override
        public String message() {
            String allowed = allowedStates.isEmpty() ? "none" : String.join(", ", allowedStates);
            return "Cannot transition from '" + fromState + "' to '" + toState
                    + "'. Allowed transitions: " + allowed;
        }
    }

    /**
     * A transition exists but one of its guards failed.
     *
     * @param guardType  Which kind of guard failed
     * @param guardValue The field, role or expression text of the guard
     * @param message    Human-readable failure message
     */
    record GuardNotSatisfied(GuardType guardType, String guardValue, String message) implements TransitionError {
    }

    enum GuardType {
        REQUIRES,
        ROLE,
        EXPRESSION
    }
}
