package org.dazzle.dsl.expression;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a field, possibly through related records.
 *
 * Dotted access ({@code contact.name}) and arrow traversal
 * ({@code self->signatory->aml_status}) both flatten into one ordered path,
 * so local and relational references resolve the same way.
 *
 * @param path The path segments, never empty
 */
public record FieldRef(List<String> path) implements Expr {

    public FieldRef {
        Objects.requireNonNull(path, "Path cannot be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Field path cannot be empty");
        }
        path = List.copyOf(path);
    }

    public static FieldRef of(String... segments) {
        return new FieldRef(List.of(segments));
    }

    /**
     * @return The first segment, usually a field of the current record
     */
    public String root() {
        return path.get(0);
    }

    public boolean isSimple() {
        return path.size() == 1;
    }

    public String dotted() {
        return String.join(".", path);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitFieldRef(this);
    }

    @Override
    public String toString() {
        return dotted();
    }
}
