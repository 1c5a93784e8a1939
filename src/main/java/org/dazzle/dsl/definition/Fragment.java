package org.dazzle.dsl.definition;

import java.util.List;

/**
 * The constructs one module contributes to the application.
 *
 * @param entities   Entity declarations, in source order
 * @param services   Domain service declarations
 * @param llmModels  llm_model declarations
 * @param llmIntents llm_intent declarations
 * @param llmConfig  The llm_config block, null when absent
 * @param vocabulary Vocabulary entries
 */
public record Fragment(
        List<EntityDefinition> entities,
        List<DomainServiceDefinition> services,
        List<LlmModelDefinition> llmModels,
        List<LlmIntentDefinition> llmIntents,
        LlmConfigDefinition llmConfig,
        List<VocabularyEntry> vocabulary) {

    public Fragment {
        entities = entities == null ? List.of() : List.copyOf(entities);
        services = services == null ? List.of() : List.copyOf(services);
        llmModels = llmModels == null ? List.of() : List.copyOf(llmModels);
        llmIntents = llmIntents == null ? List.of() : List.copyOf(llmIntents);
        vocabulary = vocabulary == null ? List.of() : List.copyOf(vocabulary);
    }

    public static Fragment empty() {
        return new Fragment(List.of(), List.of(), List.of(), List.of(), null, List.of());
    }

    public static Fragment ofEntities(EntityDefinition... entities) {
        return new Fragment(List.of(entities), List.of(), List.of(), List.of(), null, List.of());
    }
}
