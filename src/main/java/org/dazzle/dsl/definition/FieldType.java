package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * A field's type: a kind tag plus the parameters that kind takes.
 *
 * @param kind                 The kind tag
 * @param maxLength            Max length for {@code str(n)}, else null
 * @param precision            Precision for {@code decimal(p,s)}, else null
 * @param scale                Scale for {@code decimal(p,s)}, else null
 * @param enumValues           Literal values for {@code enum[...]}, else empty
 * @param refEntity            Target entity for reference kinds, else null
 * @param currency             Currency code for {@code money}, else null
 * @param relationshipBehavior Delete behavior for has_many/has_one, may be null
 * @param readonly             Whether a relationship is read-only
 */
public record FieldType(
        FieldTypeKind kind,
        Integer maxLength,
        Integer precision,
        Integer scale,
        List<String> enumValues,
        String refEntity,
        String currency,
        RelationshipBehavior relationshipBehavior,
        boolean readonly) {

    public static final String DEFAULT_CURRENCY = "GBP";

    public FieldType {
        Objects.requireNonNull(kind, "Kind cannot be null");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        if (kind.isEntityReference() && refEntity == null) {
            throw new IllegalArgumentException(kind.dslName() + " requires a target entity");
        }
    }

    public enum RelationshipBehavior {
        CASCADE,
        RESTRICT,
        NULLIFY
    }

    public static FieldType of(FieldTypeKind kind) {
        return new FieldType(kind, null, null, null, List.of(), null, null, null, false);
    }

    public static FieldType str(int maxLength) {
        return new FieldType(FieldTypeKind.STR, maxLength, null, null, List.of(), null, null, null, false);
    }

    public static FieldType decimal(int precision, int scale) {
        return new FieldType(FieldTypeKind.DECIMAL, null, precision, scale, List.of(), null, null, null, false);
    }

    public static FieldType enumOf(List<String> values) {
        return new FieldType(FieldTypeKind.ENUM, null, null, null, values, null, null, null, false);
    }

    public static FieldType money(String currency) {
        return new FieldType(FieldTypeKind.MONEY, null, null, null, List.of(), null,
                currency == null ? DEFAULT_CURRENCY : currency, null, false);
    }

    public static FieldType ref(String entity) {
        return relation(FieldTypeKind.REF, entity, null, false);
    }

    public static FieldType relation(FieldTypeKind kind, String entity, RelationshipBehavior behavior,
            boolean readonly) {
        return new FieldType(kind, null, null, null, List.of(), entity, null, behavior, readonly);
    }

    /**
     * @return The type as written in DSL source, e.g. {@code str(100)} or {@code ref Client}
     */
    public String describe() {
        return switch (kind) {
            case STR -> maxLength != null ? "str(" + maxLength + ")" : "str";
            case DECIMAL -> "decimal(" + precision + "," + scale + ")";
            case ENUM -> "enum[" + String.join(",", enumValues) + "]";
            case MONEY -> currency != null && !currency.equals(DEFAULT_CURRENCY) ? "money(" + currency + ")" : "money";
            default -> kind.isEntityReference() ? kind.dslName() + " " + refEntity : kind.dslName();
        };
    }
}
