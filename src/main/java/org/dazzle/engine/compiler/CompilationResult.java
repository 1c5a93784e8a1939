package org.dazzle.engine.compiler;

import org.dazzle.dsl.validation.Violation;
import org.dazzle.engine.link.AppSpec;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a compilation: the linked application, or the errors that
 * prevented linking, plus warnings in either case.
 *
 * @param app        The linked application, null when there are errors
 * @param errors     Parse, anti-Turing and link errors
 * @param warnings   Non-fatal findings
 * @param violations Raw anti-Turing findings, blocking or not
 */
public record CompilationResult(AppSpec app, List<String> errors, List<String> warnings, List<Violation> violations) {

    public CompilationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        violations = List.copyOf(violations);
    }

    static CompilationResult failure(List<String> errors, List<String> warnings, List<Violation> violations) {
        return new CompilationResult(null, errors, warnings, violations);
    }

    public boolean isSuccess() {
        return app != null && errors.isEmpty();
    }

    public Optional<AppSpec> appSpec() {
        return Optional.ofNullable(app);
    }
}
