package org.dazzle.dsl.definition;

import org.dazzle.dsl.expression.Expr;

import java.util.Objects;

/**
 * A derived field: {@code total: computed subtotal + tax}.
 */
public record ComputedField(String name, Expr expression) {

    public ComputedField {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }
}
