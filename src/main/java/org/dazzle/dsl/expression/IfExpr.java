package org.dazzle.dsl.expression;

import java.util.List;
import java.util.Objects;

/**
 * Conditional value: {@code if c: a elif d: b else: e}.
 *
 * The else branch is mandatory, so every evaluation yields a branch value.
 *
 * @param condition    The first condition
 * @param thenExpr     Value when the first condition holds
 * @param elifBranches Further condition/value pairs tried in order
 * @param elseExpr     Value when nothing matched
 */
public record IfExpr(Expr condition, Expr thenExpr, List<ElifBranch> elifBranches, Expr elseExpr) implements Expr {

    public IfExpr {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenExpr, "Then branch cannot be null");
        Objects.requireNonNull(elseExpr, "Else branch cannot be null");
        elifBranches = elifBranches == null ? List.of() : List.copyOf(elifBranches);
    }

    /**
     * One {@code elif condition: value} pair.
     */
    public record ElifBranch(Expr condition, Expr value) {
        public ElifBranch {
            Objects.requireNonNull(condition, "Condition cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitIf(this);
    }
}
