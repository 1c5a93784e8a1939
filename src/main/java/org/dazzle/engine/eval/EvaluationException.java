package org.dazzle.engine.eval;

/**
 * Thrown when an expression cannot be evaluated against a given context:
 * unknown function, division by zero, unknown duration unit, operand
 * types an operator does not accept, or a number or date out of range.
 *
 * Raised at evaluation time because the failure depends on runtime data.
 * Guard callers treat it as "guard did not pass".
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
