package org.dazzle.engine.link;

import org.dazzle.dsl.definition.DomainServiceDefinition;
import org.dazzle.dsl.definition.DslDefinition;
import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.LlmConfigDefinition;
import org.dazzle.dsl.definition.LlmIntentDefinition;
import org.dazzle.dsl.definition.LlmModelDefinition;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every named definition of one compilation, with the module that defined it.
 *
 * Built once by {@link Linker#buildSymbolTable}; each name is inserted at most
 * once per {@link SymbolKind}. Iteration follows insertion order.
 */
public final class SymbolTable {

    private final Map<SymbolKind, Map<String, DslDefinition>> definitions = new EnumMap<>(SymbolKind.class);
    private final Map<SymbolKind, Map<String, String>> sources = new EnumMap<>(SymbolKind.class);
    private LlmConfigDefinition llmConfig;
    private String llmConfigModule;

    SymbolTable() {
        for (SymbolKind kind : SymbolKind.values()) {
            definitions.put(kind, new LinkedHashMap<>());
            sources.put(kind, new LinkedHashMap<>());
        }
    }

    void add(SymbolKind kind, DslDefinition definition, String moduleName) {
        Map<String, DslDefinition> registry = definitions.get(kind);
        Map<String, String> origin = sources.get(kind);
        String key = definition.name();
        if (registry.containsKey(key)) {
            throw new LinkException("Duplicate " + kind.dslName() + " '" + key
                    + "' defined in modules '" + origin.get(key) + "' and '" + moduleName + "'");
        }
        registry.put(key, definition);
        origin.put(key, moduleName);
    }

    void setLlmConfig(LlmConfigDefinition config, String moduleName) {
        if (llmConfig != null) {
            throw new LinkException("Duplicate llm_config defined in module '" + moduleName
                    + "'. Only one llm_config block is allowed per app.");
        }
        llmConfig = config;
        llmConfigModule = moduleName;
    }

    @SuppressWarnings("unchecked")
    private <T extends DslDefinition> Map<String, T> view(SymbolKind kind) {
        return Collections.unmodifiableMap((Map<String, T>) (Map<String, ?>) definitions.get(kind));
    }

    public Map<String, EntityDefinition> entities() {
        return view(SymbolKind.ENTITY);
    }

    public Map<String, DomainServiceDefinition> services() {
        return view(SymbolKind.SERVICE);
    }

    public Map<String, LlmModelDefinition> llmModels() {
        return view(SymbolKind.LLM_MODEL);
    }

    public Map<String, LlmIntentDefinition> llmIntents() {
        return view(SymbolKind.LLM_INTENT);
    }

    public Optional<LlmConfigDefinition> llmConfig() {
        return Optional.ofNullable(llmConfig);
    }

    public Optional<String> llmConfigModule() {
        return Optional.ofNullable(llmConfigModule);
    }

    public Optional<EntityDefinition> findEntity(String name) {
        return Optional.ofNullable(entities().get(name));
    }

    /**
     * @return The module that defined the symbol, if it exists
     */
    public Optional<String> moduleOf(SymbolKind kind, String name) {
        return Optional.ofNullable(sources.get(kind).get(name));
    }

    public int size() {
        return definitions.values().stream().mapToInt(Map::size).sum();
    }
}
