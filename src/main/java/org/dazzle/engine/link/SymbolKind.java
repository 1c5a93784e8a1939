package org.dazzle.engine.link;

/**
 * Namespaces of the symbol table. Each kind has its own namespace, so an
 * entity and a service may share a name.
 */
public enum SymbolKind {
    ENTITY("entity"),
    SERVICE("service"),
    LLM_MODEL("llm_model"),
    LLM_INTENT("llm_intent");

    private final String dslName;

    SymbolKind(String dslName) {
        this.dslName = dslName;
    }

    public String dslName() {
        return dslName;
    }
}
