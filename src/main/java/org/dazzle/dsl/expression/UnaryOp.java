package org.dazzle.dsl.expression;

public enum UnaryOp {
    NEG,
    NOT
}
