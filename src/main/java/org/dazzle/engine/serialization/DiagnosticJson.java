package org.dazzle.engine.serialization;

import org.dazzle.dsl.validation.ValidationResult;
import org.dazzle.dsl.validation.Violation;
import org.dazzle.engine.compiler.CompilationResult;

import java.util.List;

/**
 * Writes diagnostics as JSON for editors and build tooling.
 *
 * Output is compact (no whitespace) with keys in a fixed order.
 */
public final class DiagnosticJson {

    private DiagnosticJson() {
    }

    /**
     * {@code {"success":true,"app":"shop","errors":[],"warnings":[],"violations":[]}}
     */
    public static String toJson(CompilationResult result) {
        StringBuilder sb = new StringBuilder("{");
        sb.append("\"success\":").append(result.isSuccess());
        sb.append(",\"app\":");
        appendValue(sb, result.app() != null ? result.app().name() : null);
        sb.append(",\"errors\":");
        appendStrings(sb, result.errors());
        sb.append(",\"warnings\":");
        appendStrings(sb, result.warnings());
        sb.append(",\"violations\":");
        appendViolations(sb, result.violations());
        return sb.append("}").toString();
    }

    /**
     * {@code {"passed":false,"violations":[...]}}
     */
    public static String toJson(ValidationResult result) {
        StringBuilder sb = new StringBuilder("{");
        sb.append("\"passed\":").append(result.passed());
        sb.append(",\"violations\":");
        appendViolations(sb, result.violations());
        return sb.append("}").toString();
    }

    public static String toJson(List<Violation> violations) {
        StringBuilder sb = new StringBuilder();
        appendViolations(sb, violations);
        return sb.toString();
    }

    private static void appendViolations(StringBuilder sb, List<Violation> violations) {
        sb.append("[");
        for (int i = 0; i < violations.size(); i++) {
            if (i > 0) {
                sb.append(",");
            }
            Violation v = violations.get(i);
            sb.append("{\"kind\":");
            appendValue(sb, v.kind().name());
            sb.append(",\"message\":");
            appendValue(sb, v.message());
            sb.append(",\"line\":").append(v.line());
            sb.append(",\"column\":").append(v.column());
            sb.append(",\"text\":");
            appendValue(sb, v.text());
            sb.append("}");
        }
        sb.append("]");
    }

    private static void appendStrings(StringBuilder sb, List<String> values) {
        sb.append("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(",");
            }
            appendValue(sb, values.get(i));
        }
        sb.append("]");
    }

    private static void appendValue(StringBuilder sb, String value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        sb.append("\"").append(escapeJson(value)).append("\"");
    }

    static String escapeJson(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
