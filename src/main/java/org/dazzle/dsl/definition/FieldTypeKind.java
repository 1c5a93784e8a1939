package org.dazzle.dsl.definition;

/**
 * Closed set of field type kinds.
 */
public enum FieldTypeKind {
    STR("str"),
    TEXT("text"),
    INT("int"),
    DECIMAL("decimal"),
    BOOL("bool"),
    DATE("date"),
    DATETIME("datetime"),
    UUID("uuid"),
    EMAIL("email"),
    MONEY("money"),
    ENUM("enum"),
    REF("ref"),
    HAS_MANY("has_many"),
    HAS_ONE("has_one"),
    EMBEDS("embeds"),
    BELONGS_TO("belongs_to");

    private final String dslName;

    FieldTypeKind(String dslName) {
        this.dslName = dslName;
    }

    public String dslName() {
        return dslName;
    }

    /**
     * @return True for kinds whose type names another entity
     */
    public boolean isEntityReference() {
        return this == REF || this == HAS_MANY || this == HAS_ONE || this == EMBEDS || this == BELONGS_TO;
    }

    public static FieldTypeKind fromDslName(String name) {
        for (FieldTypeKind kind : values()) {
            if (kind.dslName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
