package org.dazzle.dsl.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static check that DSL source stays declarative: no control flow, no
 * user-defined functions, no calls outside a fixed set.
 *
 * Works line by line on the raw text, so it also catches constructs the
 * parser would reject with a less helpful message. Quoted strings and
 * {@code #} comments are masked before scanning.
 */
public final class AntiTuringValidator {

    private static final Logger log = LoggerFactory.getLogger(AntiTuringValidator.class);

    /** Banned keyword to the construct it would introduce. */
    private static final Map<String, String> BANNED_KEYWORDS = Map.ofEntries(
            Map.entry("if", "conditional"),
            Map.entry("else", "conditional"),
            Map.entry("elif", "conditional"),
            Map.entry("then", "conditional"),
            Map.entry("for", "loop"),
            Map.entry("while", "loop"),
            Map.entry("loop", "loop"),
            Map.entry("repeat", "loop"),
            Map.entry("each", "loop"),
            Map.entry("def", "function definition"),
            Map.entry("fn", "function definition"),
            Map.entry("function", "function definition"),
            Map.entry("lambda", "function definition"),
            Map.entry("match", "pattern matching"),
            Map.entry("case", "pattern matching"),
            Map.entry("switch", "pattern matching"),
            Map.entry("return", "control transfer"),
            Map.entry("yield", "control transfer"),
            Map.entry("await", "control transfer"),
            Map.entry("break", "control transfer"),
            Map.entry("continue", "control transfer"));

    private static final Pattern KEYWORD = Pattern.compile(
            "\\b(" + String.join("|", new TreeSet<>(BANNED_KEYWORDS.keySet())) + ")\\b",
            Pattern.CASE_INSENSITIVE);

    private record BannedPattern(Pattern pattern, String description) {
    }

    private static final List<BannedPattern> BANNED_PATTERNS = List.of(
            new BannedPattern(Pattern.compile("=>"), "arrow function"),
            new BannedPattern(Pattern.compile("\\?\\s*[^\\s:?][^:]*:"), "ternary operator"),
            new BannedPattern(Pattern.compile("\\{\\s*\\|[^|]*\\|"), "block lambda"),
            new BannedPattern(Pattern.compile("\\bdo\\s*\\{", Pattern.CASE_INSENSITIVE), "do block"));

    private static final Pattern CALL = Pattern.compile("\\b([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    /** Lines that look like banned constructs but are DSL block headers. */
    private static final Pattern ALLOWED_LINE = Pattern.compile(
            "^\\s*(for|case|on|when)\\s+[A-Za-z_][A-Za-z0-9_]*\\s*:\\s*$");

    /** Words written with call syntax for type parameters or grouping. */
    private static final Set<String> CALL_SYNTAX_KEYWORDS = Set.of(
            "str", "text", "int", "decimal", "bool", "date", "datetime", "uuid", "email", "json",
            "enum", "ref", "money", "role", "list",
            "has_many", "has_one", "embeds", "belongs_to",
            "and", "or", "not", "in");

    public static final Set<String> ALLOWED_FUNCTIONS = Set.of(
            "count", "sum", "avg", "min", "max",
            "today", "now", "days_until", "days_since",
            "concat", "len", "abs", "round", "coalesce", "all_true",
            "upper", "lower");

    private static final String ALLOWED_FUNCTION_LIST = String.join(", ", new TreeSet<>(ALLOWED_FUNCTIONS));

    private AntiTuringValidator() {
    }

    /**
     * Scans DSL text and reports every violation, line by line. Within a line,
     * keywords come first, then patterns, then calls.
     */
    public static List<Violation> validate(String text) {
        List<Violation> violations = new ArrayList<>();
        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i], i + 1, violations);
        }
        return violations;
    }

    /**
     * Validates DSL text under the given mode. Keyword and pattern violations
     * always fail; unknown function calls fail only when {@code strict}.
     */
    public static ValidationResult validateDslContent(String text, boolean strict) {
        List<Violation> violations = validate(text);
        boolean passed = violations.stream().noneMatch(v -> v.isBlocking(strict));
        if (!passed) {
            log.debug("Anti-Turing check failed with {} violation(s)", violations.size());
        }
        return new ValidationResult(passed, violations);
    }

    /**
     * Strict validation: any violation fails.
     */
    public static ValidationResult validateDslContent(String text) {
        return validateDslContent(text, true);
    }

    private static void scanLine(String line, int lineNumber, List<Violation> out) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return;
        }
        String masked = mask(line);
        if (ALLOWED_LINE.matcher(masked).matches()) {
            return;
        }

        Matcher keyword = KEYWORD.matcher(masked);
        while (keyword.find()) {
            String word = keyword.group(1);
            String construct = BANNED_KEYWORDS.get(word.toLowerCase(Locale.ROOT));
            out.add(new Violation(ViolationKind.BANNED_KEYWORD,
                    "Banned keyword '" + word + "': " + construct + " is not allowed in the DSL",
                    lineNumber, keyword.start() + 1, line.substring(keyword.start(), keyword.end())));
        }

        for (BannedPattern banned : BANNED_PATTERNS) {
            Matcher matcher = banned.pattern().matcher(masked);
            while (matcher.find()) {
                out.add(new Violation(ViolationKind.BANNED_PATTERN,
                        "Banned pattern: " + banned.description() + " is not allowed in the DSL",
                        lineNumber, matcher.start() + 1, line.substring(matcher.start(), matcher.end())));
            }
        }

        Matcher call = CALL.matcher(masked);
        while (call.find()) {
            String name = call.group(1);
            String lower = name.toLowerCase(Locale.ROOT);
            if (CALL_SYNTAX_KEYWORDS.contains(lower) || ALLOWED_FUNCTIONS.contains(lower)
                    || BANNED_KEYWORDS.containsKey(lower)) {
                continue;
            }
            out.add(new Violation(ViolationKind.INVALID_FUNCTION_CALL,
                    "Function '" + name + "' is not allowed. Allowed functions: " + ALLOWED_FUNCTION_LIST,
                    lineNumber, call.start() + 1, name));
        }
    }

    /**
     * Blanks out quoted strings and trailing comments, keeping every other
     * character at its original column.
     */
    static String mask(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < line.length()) {
                    sb.append("  ");
                    i++;
                } else if (c == quote) {
                    sb.append(c);
                    quote = 0;
                } else {
                    sb.append(' ');
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                sb.append(c);
            } else if (c == '#') {
                break;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
