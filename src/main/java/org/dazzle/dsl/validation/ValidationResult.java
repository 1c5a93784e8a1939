package org.dazzle.dsl.validation;

import java.util.List;

/**
 * Outcome of {@link AntiTuringValidator#validateDslContent(String, boolean)}.
 *
 * @param passed     Whether the content is acceptable under the requested mode
 * @param violations Every violation found, blocking or not
 */
public record ValidationResult(boolean passed, List<Violation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public List<Violation> violationsOf(ViolationKind kind) {
        return violations.stream().filter(v -> v.kind() == kind).toList();
    }
}
