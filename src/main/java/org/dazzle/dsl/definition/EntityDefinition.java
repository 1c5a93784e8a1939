package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents an entity declaration.
 *
 * DSL syntax:
 *
 * <pre>
 * entity Ticket "Support Ticket":
 *   id: uuid pk
 *   title: str(200) required
 *   status: enum[open, assigned, closed]=open
 *   assignee: ref User optional
 *   invariant: priority >= 1
 *   transitions:
 *     open -> assigned: requires assignee
 *     assigned -> closed: role(agent)
 * </pre>
 *
 * @param name           The entity name, unique across the application
 * @param title          The display title, may be null
 * @param fields         Stored fields, in declaration order
 * @param computedFields Derived fields
 * @param constraints    Uniqueness and index constraints
 * @param stateMachine   The lifecycle, null when the entity declares no transitions
 * @param invariants     Standing constraints
 */
public record EntityDefinition(
        String name,
        String title,
        List<FieldDefinition> fields,
        List<ComputedField> computedFields,
        List<Constraint> constraints,
        StateMachine stateMachine,
        List<InvariantDefinition> invariants) implements DslDefinition {

    public EntityDefinition {
        Objects.requireNonNull(name, "Entity name cannot be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
        computedFields = computedFields == null ? List.of() : List.copyOf(computedFields);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        invariants = invariants == null ? List.of() : List.copyOf(invariants);
    }

    public static EntityDefinition of(String name, FieldDefinition... fields) {
        return new EntityDefinition(name, null, List.of(fields), List.of(), List.of(), null, List.of());
    }

    public Optional<FieldDefinition> findField(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    /**
     * @return True when a stored or computed field has this name
     */
    public boolean hasField(String fieldName) {
        return findField(fieldName).isPresent()
                || computedFields.stream().anyMatch(c -> c.name().equals(fieldName));
    }

    public Optional<StateMachine> optionalStateMachine() {
        return Optional.ofNullable(stateMachine);
    }
}
