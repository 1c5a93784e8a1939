package org.dazzle.engine.eval;

import org.dazzle.dsl.expression.BinaryExpr;
import org.dazzle.dsl.expression.BinaryOp;
import org.dazzle.dsl.expression.DurationLiteral;
import org.dazzle.dsl.expression.Expr;
import org.dazzle.dsl.expression.ExprVisitor;
import org.dazzle.dsl.expression.FieldRef;
import org.dazzle.dsl.expression.FuncCall;
import org.dazzle.dsl.expression.IfExpr;
import org.dazzle.dsl.expression.InExpr;
import org.dazzle.dsl.expression.Literal;
import org.dazzle.dsl.expression.UnaryExpr;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Sandboxed tree-walking interpreter for the expression language.
 *
 * Evaluation is pure: it reads the context, never writes it, and the only
 * ambient input is the clock used by {@code today()} and {@code now()}.
 * The evaluator itself is immutable and can be shared between threads.
 *
 * Null rules:
 * <ul>
 * <li>{@code ==} and {@code !=} accept null on either side</li>
 * <li>{@code < > <= >=} with a null operand are false</li>
 * <li>arithmetic with a null operand is null</li>
 * </ul>
 */
public final class ExpressionEvaluator {

    private final Clock clock;

    public ExpressionEvaluator() {
        this(Clock.systemDefaultZone());
    }

    public ExpressionEvaluator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public Clock clock() {
        return clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Evaluates an expression against a context.
     *
     * @param expr    The expression
     * @param context The record(s) in scope; values may be nested maps, records or beans
     * @return The value, possibly null
     * @throws EvaluationException if evaluation fails for this context, including
     *                             numeric or date results out of range
     */
    public Object evaluate(Expr expr, Map<String, ?> context) {
        Objects.requireNonNull(expr, "Expression cannot be null");
        try {
            return expr.accept(new ContextVisitor(context == null ? Map.of() : context));
        } catch (ArithmeticException | DateTimeException | NumberFormatException e) {
            throw new EvaluationException("Cannot evaluate " + expr + ": " + e.getMessage(), e);
        }
    }

    /**
     * Evaluates an expression and reduces the result to a boolean by truthiness.
     */
    public boolean test(Expr expr, Map<String, ?> context) {
        return Values.isTruthy(evaluate(expr, context));
    }

    /**
     * Visitor bound to one context. Created per evaluation so the evaluator
     * holds no per-call state.
     */
    private final class ContextVisitor implements ExprVisitor<Object> {

        private final Map<String, ?> context;

        ContextVisitor(Map<String, ?> context) {
            this.context = context;
        }

        @Override
        public Object visitLiteral(Literal literal) {
            return literal.value();
        }

        @Override
        public Object visitFieldRef(FieldRef fieldRef) {
            return FieldResolver.resolve(context, fieldRef.path());
        }

        @Override
        public Object visitDuration(DurationLiteral duration) {
            return DurationUnit.fromSymbol(duration.unit()).of(duration.value());
        }

        @Override
        public Object visitBinary(BinaryExpr binary) {
            BinaryOp op = binary.op();
            if (op == BinaryOp.AND) {
                Object left = binary.left().accept(this);
                return Values.isTruthy(left) ? binary.right().accept(this) : left;
            }
            if (op == BinaryOp.OR) {
                Object left = binary.left().accept(this);
                return Values.isTruthy(left) ? left : binary.right().accept(this);
            }

            Object left = binary.left().accept(this);
            Object right = binary.right().accept(this);

            if (op.isEquality()) {
                boolean equal = Values.areEqual(left, right);
                return op == BinaryOp.EQ ? equal : !equal;
            }
            if (op.isOrdering()) {
                return compare(op, left, right);
            }
            if (left == null || right == null) {
                return null;
            }
            return switch (op) {
                case ADD -> add(left, right);
                case SUB -> subtract(left, right);
                case MUL -> multiply(left, right);
                case DIV -> divide(left, right);
                case MOD -> modulo(left, right);
                default -> throw new EvaluationException("Unsupported operator: " + op);
            };
        }

        @Override
        public Object visitUnary(UnaryExpr unary) {
            Object value = unary.operand().accept(this);
            switch (unary.op()) {
                case NOT:
                    return !Values.isTruthy(value);
                case NEG:
                    if (value == null) {
                        return null;
                    }
                    if (value instanceof Number n) {
                        return Values.isIntegral(n) ? exact(() -> Math.negateExact(n.longValue())) : (Object) (-n.doubleValue());
                    }
                    if (value instanceof Duration d) {
                        return d.negated();
                    }
                    throw new EvaluationException("Cannot negate " + Values.typeName(value));
                default:
                    throw new EvaluationException("Unsupported operator: " + unary.op());
            }
        }

        @Override
        public Object visitFuncCall(FuncCall call) {
            BuiltinFunction function = BuiltinFunction.fromName(call.name())
                    .orElseThrow(() -> new EvaluationException("Unknown function: " + call.name()));
            function.checkArity(call.args().size());
            List<Object> args = new ArrayList<>(call.args().size());
            for (Expr arg : call.args()) {
                args.add(arg.accept(this));
            }
            return invoke(function, args);
        }

        @Override
        public Object visitIn(InExpr in) {
            Object probe = in.probe().accept(this);
            boolean found = false;
            for (Expr item : in.items()) {
                Object candidate = item.accept(this);
                if (candidate instanceof Collection<?> list && in.items().size() == 1) {
                    // in (a, b) materializes a single list argument
                    for (Object element : list) {
                        found |= Values.areEqual(probe, element);
                    }
                } else {
                    found |= Values.areEqual(probe, candidate);
                }
            }
            return in.negated() != found;
        }

        @Override
        public Object visitIf(IfExpr ifExpr) {
            if (Values.isTruthy(ifExpr.condition().accept(this))) {
                return ifExpr.thenExpr().accept(this);
            }
            for (IfExpr.ElifBranch branch : ifExpr.elifBranches()) {
                if (Values.isTruthy(branch.condition().accept(this))) {
                    return branch.value().accept(this);
                }
            }
            return ifExpr.elseExpr().accept(this);
        }
    }

    // ==================== Comparison ====================

    private Object compare(BinaryOp op, Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        // A date compared with a duration means "today plus that duration"
        if (right instanceof Duration d && Values.asDate(left) != null && !(left instanceof String)) {
            right = today().plusDays(d.toDays());
        } else if (left instanceof Duration d && Values.asDate(right) != null && !(right instanceof String)) {
            left = today().plusDays(d.toDays());
        }
        int cmp = Values.compare(left, right);
        return switch (op) {
            case LT -> cmp < 0;
            case GT -> cmp > 0;
            case LE -> cmp <= 0;
            case GE -> cmp >= 0;
            default -> throw new EvaluationException("Not an ordering operator: " + op);
        };
    }

    // ==================== Arithmetic ====================

    private static Object add(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (right instanceof Duration d && isTemporal(left)) {
            return shift(left, d);
        }
        if (left instanceof Duration d && isTemporal(right)) {
            return shift(right, d);
        }
        if (left instanceof Duration l && right instanceof Duration r) {
            return l.plus(r);
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (Values.isIntegral(l) && Values.isIntegral(r)) {
                return exact(() -> Math.addExact(l.longValue(), r.longValue()));
            }
            return l.doubleValue() + r.doubleValue();
        }
        throw incompatible("+", left, right);
    }

    private static Object subtract(Object left, Object right) {
        if (right instanceof Duration d && isTemporal(left)) {
            return shift(left, d.negated());
        }
        if (left instanceof LocalDate l && right instanceof LocalDate r) {
            return Duration.ofDays(ChronoUnit.DAYS.between(r, l));
        }
        if (left instanceof LocalDateTime l && right instanceof LocalDateTime r) {
            return Duration.between(r, l);
        }
        if (left instanceof Duration l && right instanceof Duration r) {
            return l.minus(r);
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (Values.isIntegral(l) && Values.isIntegral(r)) {
                return exact(() -> Math.subtractExact(l.longValue(), r.longValue()));
            }
            return l.doubleValue() - r.doubleValue();
        }
        throw incompatible("-", left, right);
    }

    private static Object multiply(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (Values.isIntegral(l) && Values.isIntegral(r)) {
                return exact(() -> Math.multiplyExact(l.longValue(), r.longValue()));
            }
            return l.doubleValue() * r.doubleValue();
        }
        if (left instanceof Duration d && right instanceof Number n && Values.isIntegral(n)) {
            try {
                return d.multipliedBy(n.longValue());
            } catch (ArithmeticException e) {
                throw new EvaluationException("Duration overflow", e);
            }
        }
        throw incompatible("*", left, right);
    }

    private static Object divide(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (r.doubleValue() == 0.0) {
                throw new EvaluationException("Division by zero");
            }
            return l.doubleValue() / r.doubleValue();
        }
        throw incompatible("/", left, right);
    }

    private static Object modulo(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (r.doubleValue() == 0.0) {
                throw new EvaluationException("Division by zero");
            }
            if (Values.isIntegral(l) && Values.isIntegral(r)) {
                return Math.floorMod(l.longValue(), r.longValue());
            }
            double a = l.doubleValue();
            double b = r.doubleValue();
            return a - b * Math.floor(a / b);
        }
        throw incompatible("%", left, right);
    }

    private static boolean isTemporal(Object value) {
        return value instanceof Temporal;
    }

    private static Object shift(Object temporal, Duration duration) {
        try {
            if (temporal instanceof LocalDate date) {
                return date.plusDays(duration.toDays());
            }
            return ((Temporal) temporal).plus(duration);
        } catch (DateTimeException | ArithmeticException e) {
            throw new EvaluationException("Date out of range: " + temporal + " shifted by " + duration, e);
        }
    }

    private static Object exact(LongSupplier operation) {
        try {
            return operation.getAsLong();
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow", e);
        }
    }

    private static EvaluationException incompatible(String symbol, Object left, Object right) {
        return new EvaluationException("Unsupported operand types for " + symbol + ": "
                + Values.typeName(left) + " and " + Values.typeName(right));
    }

    // ==================== Functions ====================

    private Object invoke(BuiltinFunction function, List<Object> args) {
        switch (function) {
            case TODAY:
                return today();
            case NOW:
                return LocalDateTime.now(clock);
            case DAYS_UNTIL: {
                LocalDate target = dateArgument(function, args.get(0));
                return target == null ? null : ChronoUnit.DAYS.between(today(), target);
            }
            case DAYS_SINCE: {
                LocalDate target = dateArgument(function, args.get(0));
                return target == null ? null : ChronoUnit.DAYS.between(target, today());
            }
            case CONCAT: {
                StringBuilder sb = new StringBuilder();
                for (Object arg : args) {
                    if (arg != null) {
                        sb.append(arg);
                    }
                }
                return sb.toString();
            }
            case LEN:
                return length(args.get(0));
            case UPPER:
                return args.get(0) == null ? null : args.get(0).toString().toUpperCase(Locale.ROOT);
            case LOWER:
                return args.get(0) == null ? null : args.get(0).toString().toLowerCase(Locale.ROOT);
            case ABS:
                return absolute(args.get(0));
            case MIN:
                return extreme(args, -1);
            case MAX:
                return extreme(args, 1);
            case ROUND:
                return round(args);
            case COALESCE:
                for (Object arg : args) {
                    if (arg != null) {
                        return arg;
                    }
                }
                return null;
            case COUNT:
                return args.get(0) == null ? 0L : length(args.get(0));
            case SUM:
                return sum(args.get(0));
            case AVG:
                return average(args.get(0));
            case ALL_TRUE:
                for (Object arg : args) {
                    if (!Values.isTruthy(arg)) {
                        return false;
                    }
                }
                return true;
            case LIST:
                return Collections.unmodifiableList(new ArrayList<>(args));
            default:
                throw new EvaluationException("Unknown function: " + function.dslName());
        }
    }

    private static LocalDate dateArgument(BuiltinFunction function, Object value) {
        if (value == null) {
            return null;
        }
        LocalDate date = Values.asDate(value);
        if (date == null) {
            throw new EvaluationException(function.dslName() + "() expects a date, got " + Values.typeName(value));
        }
        return date;
    }

    private static long length(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof CharSequence s) {
            return s.length();
        }
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return m.size();
        }
        if (value.getClass().isArray()) {
            return java.lang.reflect.Array.getLength(value);
        }
        throw new EvaluationException("len() does not accept " + Values.typeName(value));
    }

    private static Object absolute(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return Values.isIntegral(n) ? exact(() -> Math.absExact(n.longValue())) : (Object) Math.abs(n.doubleValue());
        }
        if (value instanceof Duration d) {
            return d.abs();
        }
        throw new EvaluationException("abs() does not accept " + Values.typeName(value));
    }

    private static Object extreme(List<Object> args, int direction) {
        List<Object> values = args.size() == 1 && args.get(0) instanceof Collection<?> c
                ? new ArrayList<>(c)
                : args;
        Object best = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (best == null || Integer.signum(Values.compare(value, best)) == direction) {
                best = value;
            }
        }
        return best;
    }

    private static Object round(List<Object> args) {
        Object value = args.get(0);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number n)) {
            throw new EvaluationException("round() expects a number, got " + Values.typeName(value));
        }
        if (args.size() == 1 && Values.isIntegral(n)) {
            return n.longValue();
        }
        if (!Double.isFinite(n.doubleValue())) {
            throw new EvaluationException("round() expects a finite number, got " + n);
        }
        if (args.size() == 1) {
            try {
                return BigDecimal.valueOf(n.doubleValue()).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
            } catch (ArithmeticException e) {
                throw new EvaluationException("round() result out of integer range: " + n, e);
            }
        }
        if (!(args.get(1) instanceof Number digits) || !Values.isIntegral(digits)) {
            throw new EvaluationException("round() expects an integer number of digits");
        }
        return BigDecimal.valueOf(n.doubleValue())
                .setScale(digits.intValue(), RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    private static Object sum(Object value) {
        if (value == null) {
            return 0L;
        }
        if (!(value instanceof Collection<?> items)) {
            throw new EvaluationException("sum() expects a list, got " + Values.typeName(value));
        }
        Object total = 0L;
        for (Object item : items) {
            if (item != null) {
                total = add(total, item);
            }
        }
        return total;
    }

    private static Object average(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Collection<?> items)) {
            throw new EvaluationException("avg() expects a list, got " + Values.typeName(value));
        }
        List<Object> present = nonNullList(items);
        if (present.isEmpty()) {
            return null;
        }
        Object total = sum(present);
        if (!(total instanceof Number n)) {
            throw new EvaluationException("avg() expects numbers, got " + Values.typeName(total));
        }
        return n.doubleValue() / present.size();
    }

    private static List<Object> nonNullList(Collection<?> items) {
        List<Object> present = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                present.add(item);
            }
        }
        return present;
    }
}
