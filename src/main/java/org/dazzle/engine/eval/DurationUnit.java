package org.dazzle.engine.eval;

import java.time.Duration;
import java.util.Locale;

/**
 * Units accepted in duration literals and their fixed conversion table.
 *
 * Minutes, hours, days and weeks are exact. Months and years are fixed
 * approximations of 30 and 365 days; existing guards and invariants depend
 * on these values, so calendar-aware arithmetic must not replace them.
 */
public enum DurationUnit {
    MINUTES("min", Duration.ofMinutes(1)),
    HOURS("h", Duration.ofHours(1)),
    DAYS("d", Duration.ofDays(1)),
    WEEKS("w", Duration.ofDays(7)),
    MONTHS("m", Duration.ofDays(30)),
    YEARS("y", Duration.ofDays(365));

    private final String symbol;
    private final Duration length;

    DurationUnit(String symbol, Duration length) {
        this.symbol = symbol;
        this.length = length;
    }

    /**
     * @return The compact symbol used in literals such as {@code 7d}
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @throws EvaluationException if the duration does not fit in a {@link Duration}
     */
    public Duration of(long amount) {
        try {
            return length.multipliedBy(amount);
        } catch (ArithmeticException e) {
            throw new EvaluationException("Duration out of range: " + amount + " " + name().toLowerCase(Locale.ROOT), e);
        }
    }

    /**
     * Parse a duration unit from DSL syntax.
     * Handles compact symbols (d, 30min) and long forms (day, days).
     */
    public static DurationUnit fromSymbol(String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "min", "mins", "minute", "minutes" -> MINUTES;
            case "h", "hr", "hrs", "hour", "hours" -> HOURS;
            case "d", "day", "days" -> DAYS;
            case "w", "week", "weeks" -> WEEKS;
            case "m", "month", "months" -> MONTHS;
            case "y", "year", "years" -> YEARS;
            default -> throw new EvaluationException("Unknown duration unit: " + unit);
        };
    }
}
