package org.dazzle.dsl.expression;

/**
 * Binary operators, grouped by how the evaluator treats null operands.
 */
public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    AND("and"),
    OR("or");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    public boolean isOrdering() {
        return this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }
}
