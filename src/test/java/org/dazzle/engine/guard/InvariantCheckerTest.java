package org.dazzle.engine.guard;

import org.dazzle.dsl.DslParser;
import org.dazzle.dsl.ExpressionParser;
import org.dazzle.dsl.definition.InvariantDefinition;
import org.dazzle.engine.eval.ExpressionEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InvariantCheckerTest {

    private static final List<InvariantDefinition> BOOKING = DslParser.parse("""
            entity Booking:
              id: uuid pk
              start_date: date
              end_date: date
              guests: int
              invariant: end_date > start_date
                message: "End date must be after start date"
                code: DATE_ORDER
              invariant: guests >= 1
            """).fragment().entities().get(0).invariants();

    private final InvariantChecker checker = new InvariantChecker();

    private static Map<String, Object> booking(LocalDate start, LocalDate end, Object guests) {
        Map<String, Object> data = new HashMap<>();
        data.put("start_date", start);
        data.put("end_date", end);
        data.put("guests", guests);
        return data;
    }

    @Test
    @DisplayName("Valid record passes every invariant")
    void testValidRecord() {
        Map<String, Object> data = booking(LocalDate.of(2026, 5, 1), LocalDate.of(2026, 5, 4), 2L);

        assertTrue(checker.violations(BOOKING, data).isEmpty());
        assertDoesNotThrow(() -> checker.checkForCreate(BOOKING, data));
    }

    @Test
    @DisplayName("Violation carries the declared message and code")
    void testDeclaredMessageAndCode() {
        Map<String, Object> data = booking(LocalDate.of(2026, 5, 4), LocalDate.of(2026, 5, 1), 2L);

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> checker.checkForCreate(BOOKING, data));

        assertEquals("End date must be after start date", e.getMessage());
        assertEquals("DATE_ORDER", e.getCode());
    }

    @Test
    @DisplayName("Invariant without a message gets one naming the expression")
    void testDefaultMessage() {
        List<InvariantViolation> violations = checker.violations(BOOKING,
                booking(LocalDate.of(2026, 5, 1), LocalDate.of(2026, 5, 2), 0L));

        assertEquals(1, violations.size());
        assertEquals("Invariant violated: (guests >= 1)", violations.get(0).message());
        assertNull(violations.get(0).code());
    }

    @Test
    @DisplayName("Values outside the numeric or date range count as a violation")
    void testOutOfRangeValues() {
        List<InvariantDefinition> horizon = DslParser.parse("""
                entity Plan:
                  id: uuid pk
                  end_date: date
                  invariant: end_date < today + 99999999999y
                """).fragment().entities().get(0).invariants();

        assertFalse(checker.holds(horizon.get(0), Map.of("end_date", LocalDate.of(2026, 5, 1))));
        assertEquals(1, checker.violations(BOOKING,
                booking(LocalDate.of(2026, 5, 1), LocalDate.of(2026, 5, 2), Double.NaN)).size());
    }

    @Test
    @DisplayName("All broken invariants are listed in declaration order")
    void testAllViolations() {
        List<InvariantViolation> violations = checker.violations(BOOKING,
                booking(LocalDate.of(2026, 5, 4), LocalDate.of(2026, 5, 1), 0L));

        assertEquals(List.of("DATE_ORDER", "Invariant violated: (guests >= 1)"),
                List.of(violations.get(0).code(), violations.get(1).message()));
    }

    @Test
    @DisplayName("Comparison with a missing value does not hold")
    void testNullDoesNotHold() {
        assertFalse(checker.holds(BOOKING.get(0), booking(LocalDate.of(2026, 5, 4), null, 1L)));
    }

    @Test
    @DisplayName("Evaluation error counts as a violation")
    void testEvaluationError() {
        assertFalse(checker.holds(BOOKING.get(1), booking(null, null, "many")));
    }

    @Test
    @DisplayName("Update is checked against the merged record")
    void testCheckForUpdate() {
        Map<String, Object> current = booking(LocalDate.of(2026, 5, 1), LocalDate.of(2026, 5, 4), 2L);

        assertDoesNotThrow(() -> checker.checkForUpdate(BOOKING, current, Map.of("guests", 3L)));
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> checker.checkForUpdate(BOOKING, current, Map.of("end_date", LocalDate.of(2026, 4, 30))));
        assertEquals("DATE_ORDER", e.getCode());
    }

    @Test
    @DisplayName("Invariants relative to today use the evaluator clock")
    void testRelativeToToday() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T00:00:00Z"), ZoneOffset.UTC);
        InvariantChecker fixed = new InvariantChecker(new ExpressionEvaluator(clock));
        InvariantDefinition recent = InvariantDefinition.of(
                ExpressionParser.parseInvariantExpr("start_date >= today - 30 days"));

        assertTrue(fixed.holds(recent, Map.of("start_date", LocalDate.of(2026, 3, 1))));
        assertFalse(fixed.holds(recent, Map.of("start_date", LocalDate.of(2026, 1, 1))));
    }
}
