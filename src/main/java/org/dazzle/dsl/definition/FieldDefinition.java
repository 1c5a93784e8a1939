package org.dazzle.dsl.definition;

import java.util.Objects;
import java.util.Set;

/**
 * A stored field of an entity.
 *
 * DSL syntax: {@code name: type [modifiers] [=default]}, e.g.
 * {@code title: str(200) required} or {@code approved: bool=false}.
 *
 * @param name         The field name
 * @param type         The field type
 * @param modifiers    The modifier set
 * @param defaultValue The default value (String, Long, Double or Boolean), may be null
 */
public record FieldDefinition(
        String name,
        FieldType type,
        Set<FieldModifier> modifiers,
        Object defaultValue) {

    public FieldDefinition {
        Objects.requireNonNull(name, "Field name cannot be null");
        Objects.requireNonNull(type, "Field type cannot be null");
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
    }

    public static FieldDefinition of(String name, FieldType type, FieldModifier... modifiers) {
        return new FieldDefinition(name, type, Set.of(modifiers), null);
    }

    public boolean has(FieldModifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isRequired() {
        return has(FieldModifier.REQUIRED) || has(FieldModifier.PK);
    }
}
