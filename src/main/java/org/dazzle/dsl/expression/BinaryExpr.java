package org.dazzle.dsl.expression;

import java.util.Objects;

/**
 * Arithmetic, comparison or logical combination of two expressions.
 *
 * @param op    The operator
 * @param left  The left operand
 * @param right The right operand
 */
public record BinaryExpr(BinaryOp op, Expr left, Expr right) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.symbol() + " " + right + ")";
    }
}
