package org.dazzle.dsl.expression;

import java.util.Objects;

/**
 * A duration such as {@code 7d}, {@code 30min} or {@code 14 days}.
 *
 * The unit is kept exactly as written; converting it to a length of time
 * is the evaluator's job.
 *
 * @param value The amount
 * @param unit  The unit symbol as written (d, h, w, min, m, y or a long form)
 */
public record DurationLiteral(long value, String unit) implements Expr {

    public DurationLiteral {
        Objects.requireNonNull(unit, "Unit cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitDuration(this);
    }

    @Override
    public String toString() {
        return value + unit;
    }
}
