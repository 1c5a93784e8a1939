package org.dazzle.dsl.expression;

import java.util.Objects;

/**
 * Numeric negation or logical not.
 *
 * @param op      The operator
 * @param operand The operand
 */
public record UnaryExpr(UnaryOp op, Expr operand) implements Expr {

    public UnaryExpr {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return (op == UnaryOp.NOT ? "not " : "-") + operand;
    }
}
