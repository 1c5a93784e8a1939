package org.dazzle.dsl.validation;

import java.util.Objects;

/**
 * A construct that would make DSL source more than declarative.
 *
 * @param kind    What was found
 * @param message Human-readable explanation
 * @param line    1-based line number
 * @param column  1-based column on the original line
 * @param text    The offending text as written
 */
public record Violation(ViolationKind kind, String message, int line, int column, String text) {

    public Violation {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public boolean isBlocking(boolean strict) {
        return kind.isBlocking(strict);
    }

    @Override
    public String toString() {
        return "line " + line + ":" + column + " " + kind + ": " + message;
    }
}
