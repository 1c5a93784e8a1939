package org.dazzle.dsl.expression;

/**
 * Sealed interface for nodes of the DSL expression language.
 *
 * The node set is closed: guards, invariants and computed fields are all
 * built from these eight kinds, and every consumer dispatches through
 * {@link ExprVisitor} so adding a kind is a compile error everywhere it
 * is not handled.
 *
 * Nodes are immutable once parsed and may be evaluated any number of times
 * against different contexts.
 */
public sealed interface Expr
        permits Literal, FieldRef, DurationLiteral, BinaryExpr, UnaryExpr, FuncCall, InExpr, IfExpr {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this node
     */
    <T> T accept(ExprVisitor<T> visitor);
}
