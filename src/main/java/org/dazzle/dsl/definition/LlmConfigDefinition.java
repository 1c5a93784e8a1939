package org.dazzle.dsl.definition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The application-wide {@code llm_config} block. At most one per application.
 *
 * @param defaultModel  Model used by intents that name none, may be null
 * @param artifactStore Where prompts and completions are kept
 * @param rateLimits    Requests per minute, keyed by model name
 */
public record LlmConfigDefinition(String defaultModel, ArtifactStore artifactStore, Map<String, Integer> rateLimits) {

    public enum ArtifactStore {
        LOCAL,
        S3,
        GCS
    }

    public LlmConfigDefinition {
        artifactStore = artifactStore == null ? ArtifactStore.LOCAL : artifactStore;
        rateLimits = rateLimits == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rateLimits));
    }

    public static LlmConfigDefinition withDefault(String defaultModel) {
        return new LlmConfigDefinition(defaultModel, ArtifactStore.LOCAL, Map.of());
    }

    public Integer rateLimit(String model) {
        Objects.requireNonNull(model, "Model cannot be null");
        return rateLimits.get(model);
    }
}
