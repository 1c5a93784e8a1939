package org.dazzle.engine.compiler;

/**
 * Per-compilation settings.
 *
 * @param strict         Unknown function calls fail the anti-Turing check instead of warning
 * @param antiTuring     Run the anti-Turing check on source text before parsing
 * @param failOnWarnings Treat link warnings as errors
 */
public record CompilerOptions(boolean strict, boolean antiTuring, boolean failOnWarnings) {

    public static CompilerOptions defaults() {
        return new CompilerOptions(false, true, false);
    }

    public CompilerOptions withStrict(boolean strict) {
        return new CompilerOptions(strict, antiTuring, failOnWarnings);
    }

    public CompilerOptions withAntiTuring(boolean antiTuring) {
        return new CompilerOptions(strict, antiTuring, failOnWarnings);
    }

    public CompilerOptions withFailOnWarnings(boolean failOnWarnings) {
        return new CompilerOptions(strict, antiTuring, failOnWarnings);
    }
}
