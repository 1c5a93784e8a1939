package org.dazzle.dsl.definition;

import org.dazzle.dsl.expression.Expr;

import java.util.Objects;

/**
 * A standing constraint on an entity's fields.
 *
 * DSL syntax:
 *
 * <pre>
 * invariant: end_date > start_date
 *   message: "End date must be after start date"
 *   code: DATE_ORDER
 * </pre>
 *
 * @param expression The condition that must always hold
 * @param message    Human-readable failure message, may be null
 * @param code       Machine-readable error code, may be null
 */
public record InvariantDefinition(Expr expression, String message, String code) {

    public InvariantDefinition {
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public static InvariantDefinition of(Expr expression) {
        return new InvariantDefinition(expression, null, null);
    }
}
