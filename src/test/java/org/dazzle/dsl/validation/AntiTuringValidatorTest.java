package org.dazzle.dsl.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AntiTuringValidatorTest {

    private static final String DECLARATIVE_SOURCE = """
            module support.tickets

            entity Ticket "Support Ticket":
              id: uuid pk
              title: str(200) required
              code: str(20) unique?
              status: enum[open,assigned,closed]=open
              rate: decimal(10,2)
              assignee: ref Person
              age_days: computed days_since(created_at)
              invariant: rate >= 0
                message: "Rate cannot be negative"

              transitions:
                open -> assigned: requires assignee
                assigned -> closed: auto after 7 days or manual
                * -> open: role(admin)
            """;

    @Test
    @DisplayName("Conditional written in a field reports if, then and else with positions")
    void testConditionalKeywords() {
        List<Violation> violations = AntiTuringValidator.validate(
                "entity Task:\n  status: if completed then \"done\" else \"pending\"\n");

        assertEquals(3, violations.size());
        assertEquals(List.of("if", "then", "else"), violations.stream().map(Violation::text).toList());
        assertTrue(violations.stream().allMatch(v -> v.kind() == ViolationKind.BANNED_KEYWORD));
        assertTrue(violations.stream().allMatch(v -> v.line() == 2));
        assertEquals(List.of(11, 24, 36), violations.stream().map(Violation::column).toList());
        assertEquals("Banned keyword 'if': conditional is not allowed in the DSL", violations.get(0).message());
    }

    @Test
    @DisplayName("Keywords inside strings and comments are ignored")
    void testStringsAndCommentsIgnored() {
        String source = """
                # while we wait, for each ticket, if needed
                entity Task:
                  label: str="if you can, return it"  # loop over items
                  note: text='match case'
                """;

        assertTrue(AntiTuringValidator.validate(source).isEmpty());
    }

    @Test
    @DisplayName("Keywords embedded in longer identifiers are not reported")
    void testWordBoundaries() {
        String source = """
                entity Task:
                  format: str
                  endif_date: date
                  returned: bool
                """;

        assertTrue(AntiTuringValidator.validate(source).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"while", "for", "def", "lambda", "match", "switch", "return", "yield"})
    @DisplayName("Each banned keyword is reported")
    void testBannedKeyword(String keyword) {
        List<Violation> violations = AntiTuringValidator.validate("  total: computed " + keyword + " x\n");

        assertEquals(1, violations.size());
        assertEquals(ViolationKind.BANNED_KEYWORD, violations.get(0).kind());
        assertEquals(19, violations.get(0).column());
    }

    @Test
    @DisplayName("Keyword matching ignores case")
    void testKeywordCaseInsensitive() {
        List<Violation> violations = AntiTuringValidator.validate("x: computed IF a ELSE b\n");

        assertEquals(2, violations.size());
        assertEquals("Banned keyword 'IF': conditional is not allowed in the DSL", violations.get(0).message());
    }

    @Test
    @DisplayName("Block header lines such as 'for role:' are allowed")
    void testAllowedHeaderLines() {
        String source = """
                workspace main:
                  for admin:
                  when ready:
                  case urgent :
                """;

        assertTrue(AntiTuringValidator.validate(source).isEmpty());
    }

    @Test
    @DisplayName("Ternary, arrow function, block lambda and do block are banned patterns")
    void testBannedPatterns() {
        String source = """
                a: computed x ? y : z
                b: computed items.map(i => i)
                c: computed each { |i| i }
                d: computed do { x }
                """;

        List<Violation> patterns = AntiTuringValidator.validateDslContent(source)
                .violationsOf(ViolationKind.BANNED_PATTERN);

        assertEquals(4, patterns.size());
        assertEquals("Banned pattern: ternary operator is not allowed in the DSL", patterns.get(0).message());
        assertEquals(1, patterns.get(0).line());
        assertEquals(15, patterns.get(0).column());
        assertEquals("=>", patterns.get(1).text());
        assertTrue(patterns.get(2).message().contains("block lambda"));
        assertTrue(patterns.get(3).message().contains("do block"));
    }

    @Test
    @DisplayName("Unknown function call is reported with the allowed list")
    void testUnknownFunction() {
        List<Violation> violations = AntiTuringValidator.validate("  price: computed fetch_price(sku)\n");

        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertEquals(ViolationKind.INVALID_FUNCTION_CALL, violation.kind());
        assertEquals("fetch_price", violation.text());
        assertEquals(19, violation.column());
        assertTrue(violation.message().startsWith("Function 'fetch_price' is not allowed. Allowed functions: abs, all_true, avg"));
    }

    @Test
    @DisplayName("Type parameters and allowed functions are not calls")
    void testAllowedCallSyntax() {
        String source = """
                amount: money(GBP)
                label: str(50)
                total: computed round(sum(items.amount), 2)
                checked: computed all_true(a, b) and not (c or d)
                """;

        assertTrue(AntiTuringValidator.validate(source).isEmpty());
    }

    @Test
    @DisplayName("Strict mode fails on unknown calls; non-strict only warns")
    void testStrictMode() {
        String source = "x: computed fetch(y)\n";

        ValidationResult strict = AntiTuringValidator.validateDslContent(source, true);
        ValidationResult lenient = AntiTuringValidator.validateDslContent(source, false);

        assertFalse(strict.passed());
        assertTrue(lenient.passed());
        assertEquals(1, lenient.violations().size());
    }

    @Test
    @DisplayName("Keywords fail validation in either mode")
    void testKeywordsAlwaysBlock() {
        ValidationResult result = AntiTuringValidator.validateDslContent("x: computed if a: 1 else: 2\n", false);

        assertFalse(result.passed());
        assertEquals(2, result.violationsOf(ViolationKind.BANNED_KEYWORD).size());
    }

    @Test
    @DisplayName("Declarative module passes")
    void testDeclarativeSourcePasses() {
        ValidationResult result = AntiTuringValidator.validateDslContent(DECLARATIVE_SOURCE);

        assertTrue(result.passed(), () -> "Unexpected violations: " + result.violations());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    @DisplayName("Masking blanks string contents and drops comments, keeping columns")
    void testMask() {
        assertEquals("a \"   \" ", AntiTuringValidator.mask("a \"b#c\" # d"));
        assertEquals("x = '  '", AntiTuringValidator.mask("x = 'it'"));
        assertEquals("\"    \"", AntiTuringValidator.mask("\"a\\\"b\""));
    }
}
