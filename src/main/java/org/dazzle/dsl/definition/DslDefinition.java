package org.dazzle.dsl.definition;

/**
 * Sealed interface representing named top-level DSL declarations that
 * enter the application-wide symbol table.
 *
 * These are parsed from DSL source files containing:
 * - entity declarations
 * - domain service declarations
 * - llm_model and llm_intent declarations
 */
public sealed interface DslDefinition
        permits EntityDefinition, DomainServiceDefinition, LlmModelDefinition, LlmIntentDefinition {

    /**
     * @return The declared name, unique across the linked application
     */
    String name();
}
