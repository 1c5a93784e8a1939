package org.dazzle.dsl.expression;

/**
 * Visitor over the closed set of expression nodes.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExprVisitor<T> {

    T visitLiteral(Literal literal);

    T visitFieldRef(FieldRef fieldRef);

    T visitDuration(DurationLiteral duration);

    T visitBinary(BinaryExpr binary);

    T visitUnary(UnaryExpr unary);

    T visitFuncCall(FuncCall call);

    T visitIn(InExpr in);

    T visitIf(IfExpr ifExpr);
}
