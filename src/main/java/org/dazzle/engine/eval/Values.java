package org.dazzle.engine.eval;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Map;

/**
 * Value semantics shared by the evaluator and the guard layer:
 * truthiness, numeric normalization, equality and ordering.
 */
public final class Values {

    private Values() {
    }

    // ==================== Truthiness ====================

    /**
     * Null, false, zero, empty strings, empty collections and a zero duration
     * are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return isIntegral(n) ? n.longValue() != 0 : n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof Duration d) {
            return !d.isZero();
        }
        return true;
    }

    // ==================== Numbers ====================

    static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || (n instanceof BigInteger big && big.bitLength() < 64);
    }

    /**
     * False for NaN and the infinities, which have no {@link BigDecimal} form.
     */
    static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return Double.isFinite(n.doubleValue());
        }
        return true;
    }

    // ==================== Equality ====================

    /**
     * Null-tolerant equality. Numbers compare by value regardless of their
     * boxed type, so {@code 1 == 1.0} holds.
     */
    public static boolean areEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return l.longValue() == r.longValue();
            }
            if (!isFinite(l) || !isFinite(r)) {
                return l.doubleValue() == r.doubleValue();
            }
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        if (left instanceof Enum<?> e && right instanceof String s) {
            return e.name().equals(s);
        }
        if (left instanceof String s && right instanceof Enum<?> e) {
            return e.name().equals(s);
        }
        return left.equals(right);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal big) {
            return big;
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }

    // ==================== Ordering ====================

    /**
     * Orders two non-null values of compatible types.
     *
     * @throws EvaluationException if the values cannot be ordered
     */
    static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            if (!isFinite(l) || !isFinite(r)) {
                if (Double.isNaN(l.doubleValue()) || Double.isNaN(r.doubleValue())) {
                    throw new EvaluationException("Cannot order NaN");
                }
                return Double.compare(l.doubleValue(), r.doubleValue());
            }
            return toBigDecimal(l).compareTo(toBigDecimal(r));
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof LocalDate || right instanceof LocalDate) {
            LocalDate l = asDate(left);
            LocalDate r = asDate(right);
            if (l != null && r != null) {
                return l.compareTo(r);
            }
        }
        if (left instanceof LocalDateTime l && right instanceof LocalDateTime r) {
            return l.compareTo(r);
        }
        if (left instanceof Duration l && right instanceof Duration r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return l.compareTo(r);
        }
        throw new EvaluationException("Cannot compare " + typeName(left) + " with " + typeName(right));
    }

    /**
     * Coerces dates, date-times and ISO date strings to a date, or null.
     */
    static LocalDate asDate(Object value) {
        if (value instanceof LocalDate d) {
            return d;
        }
        if (value instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDate();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toLocalDate();
        }
        if (value instanceof String s) {
            try {
                return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
