package org.dazzle.dsl.definition;

import java.util.Objects;

/**
 * An {@code llm_intent} declaration: a named prompt bound to a model.
 *
 * @param name           The intent name
 * @param title          The display title, may be null
 * @param modelRef       The llm_model to use, null to fall back to llm_config's default
 * @param prompt         The prompt template
 * @param outputSchema   Entity describing the structured output, may be null
 * @param timeoutSeconds Call timeout
 * @param retry          Retry policy
 */
public record LlmIntentDefinition(
        String name,
        String title,
        String modelRef,
        String prompt,
        String outputSchema,
        int timeoutSeconds,
        RetryPolicy retry) implements DslDefinition {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public LlmIntentDefinition {
        Objects.requireNonNull(name, "Intent name cannot be null");
        Objects.requireNonNull(prompt, "Prompt cannot be null");
        retry = retry == null ? RetryPolicy.defaults() : retry;
    }

    public static LlmIntentDefinition of(String name, String modelRef, String prompt) {
        return new LlmIntentDefinition(name, null, modelRef, prompt, null, DEFAULT_TIMEOUT_SECONDS, null);
    }

    public record RetryPolicy(int maxAttempts, Backoff backoff) {

        public enum Backoff {
            LINEAR,
            EXPONENTIAL
        }

        public RetryPolicy {
            Objects.requireNonNull(backoff, "Backoff cannot be null");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("max_attempts must be at least 1");
            }
        }

        public static RetryPolicy defaults() {
            return new RetryPolicy(3, Backoff.EXPONENTIAL);
        }
    }
}
