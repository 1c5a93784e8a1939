package org.dazzle.dsl.definition;

public enum FieldModifier {
    REQUIRED("required"),
    OPTIONAL("optional"),
    PK("pk"),
    UNIQUE("unique"),
    UNIQUE_NULLABLE("unique?"),
    AUTO_ADD("auto_add"),
    AUTO_UPDATE("auto_update");

    private final String dslName;

    FieldModifier(String dslName) {
        this.dslName = dslName;
    }

    public String dslName() {
        return dslName;
    }
}
