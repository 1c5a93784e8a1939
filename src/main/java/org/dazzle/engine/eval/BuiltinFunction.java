package org.dazzle.engine.eval;

import org.dazzle.dsl.expression.FuncCall;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of functions an expression may call.
 *
 * Every entry is pure apart from reading the evaluator's clock, so guard
 * evaluation can be retried safely. Adding an entry here is the only way
 * to give expressions a new capability.
 */
public enum BuiltinFunction {
    // Date
    TODAY("today", 0, 0),
    NOW("now", 0, 0),
    DAYS_UNTIL("days_until", 1, 1),
    DAYS_SINCE("days_since", 1, 1),

    // String
    CONCAT("concat", 0, Integer.MAX_VALUE),
    LEN("len", 1, 1),
    UPPER("upper", 1, 1),
    LOWER("lower", 1, 1),

    // Numeric
    ABS("abs", 1, 1),
    MIN("min", 1, Integer.MAX_VALUE),
    MAX("max", 1, Integer.MAX_VALUE),
    ROUND("round", 1, 2),

    // Null handling
    COALESCE("coalesce", 0, Integer.MAX_VALUE),

    // Aggregates over lists
    COUNT("count", 1, 1),
    SUM("sum", 1, 1),
    AVG("avg", 1, 1),

    // Guard checklist
    ALL_TRUE("all_true", 0, Integer.MAX_VALUE),

    // Materializes in (a, b, c)
    LIST(FuncCall.LIST_CONSTRUCTOR, 0, Integer.MAX_VALUE);

    private static final Map<String, BuiltinFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BuiltinFunction::dslName, Function.identity()));

    private final String dslName;
    private final int minArgs;
    private final int maxArgs;

    BuiltinFunction(String dslName, int minArgs, int maxArgs) {
        this.dslName = dslName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public String dslName() {
        return dslName;
    }

    public static Optional<BuiltinFunction> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    void checkArity(int count) {
        if (count < minArgs || count > maxArgs) {
            String expected = minArgs == maxArgs
                    ? String.valueOf(minArgs)
                    : maxArgs == Integer.MAX_VALUE ? "at least " + minArgs : minArgs + " to " + maxArgs;
            throw new EvaluationException(
                    dslName + "() expects " + expected + " argument(s), got " + count);
        }
    }
}
