package org.dazzle.dsl.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers every field reference in an expression, in source order.
 */
public final class FieldRefCollector implements ExprVisitor<Void> {

    private final List<FieldRef> refs = new ArrayList<>();

    private FieldRefCollector() {
    }

    public static List<FieldRef> collect(Expr expr) {
        FieldRefCollector collector = new FieldRefCollector();
        expr.accept(collector);
        return List.copyOf(collector.refs);
    }

    @Override
    public Void visitLiteral(Literal literal) {
        return null;
    }

    @Override
    public Void visitFieldRef(FieldRef fieldRef) {
        refs.add(fieldRef);
        return null;
    }

    @Override
    public Void visitDuration(DurationLiteral duration) {
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr binary) {
        binary.left().accept(this);
        binary.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr unary) {
        unary.operand().accept(this);
        return null;
    }

    @Override
    public Void visitFuncCall(FuncCall call) {
        call.args().forEach(arg -> arg.accept(this));
        return null;
    }

    @Override
    public Void visitIn(InExpr in) {
        in.probe().accept(this);
        in.items().forEach(item -> item.accept(this));
        return null;
    }

    @Override
    public Void visitIf(IfExpr ifExpr) {
        ifExpr.condition().accept(this);
        ifExpr.thenExpr().accept(this);
        for (IfExpr.ElifBranch branch : ifExpr.elifBranches()) {
            branch.condition().accept(this);
            branch.value().accept(this);
        }
        ifExpr.elseExpr().accept(this);
        return null;
    }
}
