package org.dazzle.engine.guard;

/**
 * Thrown when a create or update would leave a record breaking an invariant.
 */
public class InvariantViolationException extends RuntimeException {

    private final String code;

    public InvariantViolationException(String message, String code) {
        super(message);
        this.code = code;
    }

    /**
     * @return The invariant's machine-readable code, may be null
     */
    public String getCode() {
        return code;
    }
}
