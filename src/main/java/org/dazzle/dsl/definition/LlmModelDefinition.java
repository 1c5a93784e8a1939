package org.dazzle.dsl.definition;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An {@code llm_model} declaration.
 *
 * @param name            The model's DSL name
 * @param title           The display title, may be null
 * @param provider        The hosting provider
 * @param modelId         The provider's model identifier
 * @param tier            Cost/quality tier
 * @param maxTokens       Output token cap
 * @param costPer1kInput  Price per thousand input tokens, may be null
 * @param costPer1kOutput Price per thousand output tokens, may be null
 */
public record LlmModelDefinition(
        String name,
        String title,
        Provider provider,
        String modelId,
        Tier tier,
        int maxTokens,
        BigDecimal costPer1kInput,
        BigDecimal costPer1kOutput) implements DslDefinition {

    public static final int DEFAULT_MAX_TOKENS = 4096;

    public enum Provider {
        ANTHROPIC,
        OPENAI,
        GOOGLE,
        LOCAL
    }

    public enum Tier {
        FAST,
        BALANCED,
        QUALITY
    }

    public LlmModelDefinition {
        Objects.requireNonNull(name, "Model name cannot be null");
        Objects.requireNonNull(provider, "Provider cannot be null");
        Objects.requireNonNull(modelId, "Model id cannot be null");
        tier = tier == null ? Tier.BALANCED : tier;
    }

    public static LlmModelDefinition of(String name, Provider provider, String modelId) {
        return new LlmModelDefinition(name, null, provider, modelId, Tier.BALANCED, DEFAULT_MAX_TOKENS, null, null);
    }
}
