package org.dazzle.dsl.validation;

public enum ViolationKind {
    /** Control-flow or definition keyword such as {@code if} or {@code lambda}. */
    BANNED_KEYWORD,
    /** Punctuation that builds control flow, such as {@code =>} or {@code ? :}. */
    BANNED_PATTERN,
    /** Call to a function outside the allowed set. */
    INVALID_FUNCTION_CALL;

    /**
     * Keyword and pattern violations always fail validation; unknown calls
     * fail only in strict mode.
     */
    public boolean isBlocking(boolean strict) {
        return this != INVALID_FUNCTION_CALL || strict;
    }
}
