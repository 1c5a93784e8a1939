package org.dazzle.dsl.expression;

import java.util.List;
import java.util.Objects;

/**
 * Membership test: {@code status in ["open", "pending"]} or its negation.
 *
 * @param probe   The value being tested
 * @param items   The candidate values
 * @param negated True for {@code not in}
 */
public record InExpr(Expr probe, List<Expr> items, boolean negated) implements Expr {

    public InExpr {
        Objects.requireNonNull(probe, "Probe cannot be null");
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitIn(this);
    }
}
