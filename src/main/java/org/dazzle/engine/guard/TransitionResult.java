package org.dazzle.engine.guard;

import org.dazzle.dsl.definition.Transition;

/**
 * Outcome of validating a state change.
 *
 * @param valid      Whether the change is allowed
 * @param transition The matched transition, null when none matched or the state is unchanged
 * @param error      The reason for refusal, null when valid
 */
public record TransitionResult(boolean valid, Transition transition, TransitionError error) {

    public static TransitionResult allowed(Transition transition) {
        return new TransitionResult(true, transition, null);
    }

    public static TransitionResult rejected(Transition transition, TransitionError error) {
        return new TransitionResult(false, transition, error);
    }

    public String errorMessage() {
        return error != null ? error.message() : null;
    }
}
