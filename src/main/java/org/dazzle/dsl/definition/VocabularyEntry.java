package org.dazzle.dsl.definition;

import java.util.Objects;

/**
 * A domain term and its definition from a {@code vocabulary:} block.
 */
public record VocabularyEntry(String term, String definition) {

    public VocabularyEntry {
        Objects.requireNonNull(term, "Term cannot be null");
        Objects.requireNonNull(definition, "Definition cannot be null");
    }
}
