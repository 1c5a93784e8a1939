package org.dazzle.engine.link;

import org.dazzle.dsl.definition.DomainServiceDefinition;
import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.LlmConfigDefinition;
import org.dazzle.dsl.definition.LlmIntentDefinition;
import org.dazzle.dsl.definition.LlmModelDefinition;
import org.dazzle.dsl.definition.VocabularyEntry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The linked application: every module's declarations merged in module order.
 *
 * @param name       The app name, from the first {@code app} declaration
 * @param title      The app title, may be null
 * @param modules    Module names in link order
 * @param entities   All entities
 * @param services   All domain services
 * @param llmModels  All LLM models
 * @param llmIntents All LLM intents
 * @param llmConfig  The application's llm_config, may be null
 * @param vocabulary All vocabulary entries
 */
public record AppSpec(
        String name,
        String title,
        List<String> modules,
        List<EntityDefinition> entities,
        List<DomainServiceDefinition> services,
        List<LlmModelDefinition> llmModels,
        List<LlmIntentDefinition> llmIntents,
        LlmConfigDefinition llmConfig,
        List<VocabularyEntry> vocabulary) {

    public AppSpec {
        Objects.requireNonNull(name, "App name cannot be null");
        modules = List.copyOf(modules);
        entities = List.copyOf(entities);
        services = List.copyOf(services);
        llmModels = List.copyOf(llmModels);
        llmIntents = List.copyOf(llmIntents);
        vocabulary = List.copyOf(vocabulary);
    }

    public Optional<EntityDefinition> findEntity(String entityName) {
        return entities.stream().filter(e -> e.name().equals(entityName)).findFirst();
    }

    public Optional<DomainServiceDefinition> findService(String serviceName) {
        return services.stream().filter(s -> s.name().equals(serviceName)).findFirst();
    }

    public TypeCatalog typeCatalog() {
        return TypeCatalog.of(entities);
    }
}
