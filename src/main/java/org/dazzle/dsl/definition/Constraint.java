package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * Entity-level uniqueness or index constraint: {@code unique email, tenant}.
 */
public record Constraint(Kind kind, List<String> fields) {

    public enum Kind {
        UNIQUE,
        INDEX
    }

    public Constraint {
        Objects.requireNonNull(kind, "Kind cannot be null");
        fields = List.copyOf(fields);
    }
}
