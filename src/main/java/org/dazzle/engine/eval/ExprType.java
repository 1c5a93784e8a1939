package org.dazzle.engine.eval;

/**
 * Static value categories inferred for expressions.
 */
public enum ExprType {
    INT,
    FLOAT,
    STR,
    BOOL,
    NULL,
    DURATION,
    DATE,
    DATETIME,
    MONEY,
    ANY;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
