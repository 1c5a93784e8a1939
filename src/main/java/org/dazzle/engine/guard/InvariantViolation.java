package org.dazzle.engine.guard;

import org.dazzle.dsl.definition.InvariantDefinition;

/**
 * An invariant that did not hold for a record.
 */
public record InvariantViolation(InvariantDefinition invariant, String message, String code) {

    public InvariantViolationException toException() {
        return new InvariantViolationException(message, code);
    }
}
