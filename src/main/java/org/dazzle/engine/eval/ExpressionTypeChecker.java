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
import org.dazzle.dsl.expression.UnaryOp;

import java.util.Map;
import java.util.Optional;

/**
 * Best-effort static type inference for expressions.
 *
 * Field types come from the caller; unknown fields and anything the rules
 * below cannot decide infer as {@link ExprType#ANY}.
 */
public final class ExpressionTypeChecker {

    private ExpressionTypeChecker() {
    }

    public static ExprType inferType(Expr expr) {
        return inferType(expr, Map.of());
    }

    /**
     * @param expr       The expression
     * @param fieldTypes Known field types, keyed by field name or dotted path
     */
    public static ExprType inferType(Expr expr, Map<String, ExprType> fieldTypes) {
        return expr.accept(new Inference(fieldTypes));
    }

    private static final class Inference implements ExprVisitor<ExprType> {

        private final Map<String, ExprType> fieldTypes;

        Inference(Map<String, ExprType> fieldTypes) {
            this.fieldTypes = fieldTypes;
        }

        @Override
        public ExprType visitLiteral(Literal literal) {
            Object value = literal.value();
            if (value == null) {
                return ExprType.NULL;
            }
            if (value instanceof Boolean) {
                return ExprType.BOOL;
            }
            if (value instanceof String) {
                return ExprType.STR;
            }
            if (value instanceof Number n) {
                return Values.isIntegral(n) ? ExprType.INT : ExprType.FLOAT;
            }
            return ExprType.ANY;
        }

        @Override
        public ExprType visitFieldRef(FieldRef fieldRef) {
            ExprType type = fieldTypes.get(fieldRef.dotted());
            if (type == null && fieldRef.isSimple()) {
                type = fieldTypes.get(fieldRef.root());
            }
            return type == null ? ExprType.ANY : type;
        }

        @Override
        public ExprType visitDuration(DurationLiteral duration) {
            return ExprType.DURATION;
        }

        @Override
        public ExprType visitBinary(BinaryExpr binary) {
            BinaryOp op = binary.op();
            if (op.isLogical() || op.isEquality() || op.isOrdering()) {
                return ExprType.BOOL;
            }
            ExprType left = binary.left().accept(this);
            ExprType right = binary.right().accept(this);
            if (op == BinaryOp.DIV) {
                return left == ExprType.MONEY && right.isNumeric() ? ExprType.MONEY : ExprType.FLOAT;
            }
            if (op == BinaryOp.ADD || op == BinaryOp.SUB) {
                if ((left == ExprType.DATE || left == ExprType.DATETIME) && right == ExprType.DURATION) {
                    return left;
                }
                if (op == BinaryOp.ADD && left == ExprType.DURATION
                        && (right == ExprType.DATE || right == ExprType.DATETIME)) {
                    return right;
                }
                if (op == BinaryOp.SUB && left == right
                        && (left == ExprType.DATE || left == ExprType.DATETIME)) {
                    return ExprType.DURATION;
                }
                if (left == ExprType.DURATION && right == ExprType.DURATION) {
                    return ExprType.DURATION;
                }
                if (op == BinaryOp.ADD && left == ExprType.STR && right == ExprType.STR) {
                    return ExprType.STR;
                }
            }
            if (left == ExprType.MONEY || right == ExprType.MONEY) {
                ExprType other = left == ExprType.MONEY ? right : left;
                if (other == ExprType.MONEY || other.isNumeric()) {
                    return ExprType.MONEY;
                }
                return ExprType.ANY;
            }
            if (left == ExprType.INT && right == ExprType.INT) {
                return ExprType.INT;
            }
            if (left.isNumeric() && right.isNumeric()) {
                return ExprType.FLOAT;
            }
            return ExprType.ANY;
        }

        @Override
        public ExprType visitUnary(UnaryExpr unary) {
            if (unary.op() == UnaryOp.NOT) {
                return ExprType.BOOL;
            }
            return unary.operand().accept(this);
        }

        @Override
        public ExprType visitFuncCall(FuncCall call) {
            Optional<BuiltinFunction> function = BuiltinFunction.fromName(call.name());
            if (function.isEmpty()) {
                return ExprType.ANY;
            }
            switch (function.get()) {
                case TODAY:
                    return ExprType.DATE;
                case NOW:
                    return ExprType.DATETIME;
                case DAYS_UNTIL:
                case DAYS_SINCE:
                case LEN:
                case COUNT:
                    return ExprType.INT;
                case CONCAT:
                case UPPER:
                case LOWER:
                    return ExprType.STR;
                case ALL_TRUE:
                    return ExprType.BOOL;
                case AVG:
                    return ExprType.FLOAT;
                case ROUND:
                    return call.args().size() == 1 ? ExprType.INT : ExprType.FLOAT;
                case ABS:
                case MIN:
                case MAX:
                case COALESCE:
                    return firstKnown(call);
                default:
                    return ExprType.ANY;
            }
        }

        private ExprType firstKnown(FuncCall call) {
            for (Expr arg : call.args()) {
                ExprType type = arg.accept(this);
                if (type != ExprType.NULL) {
                    return type;
                }
            }
            return ExprType.ANY;
        }

        @Override
        public ExprType visitIn(InExpr in) {
            return ExprType.BOOL;
        }

        @Override
        public ExprType visitIf(IfExpr ifExpr) {
            return ifExpr.thenExpr().accept(this);
        }
    }
}
