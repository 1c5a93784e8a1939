package org.dazzle.engine.eval;

import org.dazzle.dsl.ExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTypeCheckerTest {

    private static final Map<String, ExprType> FIELDS = Map.of(
            "due_date", ExprType.DATE,
            "created_at", ExprType.DATETIME,
            "price", ExprType.MONEY,
            "quantity", ExprType.INT,
            "owner.name", ExprType.STR);

    private static ExprType infer(String expression) {
        return ExpressionTypeChecker.inferType(ExpressionParser.parseExpr(expression), FIELDS);
    }

    @Test
    @DisplayName("Literals")
    void testLiterals() {
        assertEquals(ExprType.INT, infer("1"));
        assertEquals(ExprType.FLOAT, infer("1.5"));
        assertEquals(ExprType.STR, infer("\"x\""));
        assertEquals(ExprType.BOOL, infer("true"));
        assertEquals(ExprType.NULL, infer("null"));
        assertEquals(ExprType.DURATION, infer("3d"));
    }

    @Test
    @DisplayName("Comparisons, logic and membership are boolean")
    void testBooleanResults() {
        assertEquals(ExprType.BOOL, infer("quantity > 3 and not flag"));
        assertEquals(ExprType.BOOL, infer("status in [\"a\"]"));
    }

    @Test
    @DisplayName("Numeric promotion")
    void testNumericPromotion() {
        assertEquals(ExprType.INT, infer("quantity * 2"));
        assertEquals(ExprType.FLOAT, infer("quantity * 2.5"));
        assertEquals(ExprType.FLOAT, infer("quantity / 2"));
    }

    @Test
    @DisplayName("Money absorbs numeric operands")
    void testMoney() {
        assertEquals(ExprType.MONEY, infer("price * quantity"));
        assertEquals(ExprType.MONEY, infer("price / 2"));
        assertEquals(ExprType.ANY, infer("price + \"x\""));
    }

    @Test
    @DisplayName("Date arithmetic")
    void testDateArithmetic() {
        assertEquals(ExprType.DATE, infer("due_date + 7d"));
        assertEquals(ExprType.DATETIME, infer("created_at - 2h"));
        assertEquals(ExprType.DATE, infer("1w + due_date"));
        assertEquals(ExprType.DURATION, infer("due_date - due_date"));
    }

    @Test
    @DisplayName("Function result types")
    void testFunctions() {
        assertEquals(ExprType.DATE, infer("today()"));
        assertEquals(ExprType.DATETIME, infer("now()"));
        assertEquals(ExprType.INT, infer("days_until(due_date)"));
        assertEquals(ExprType.STR, infer("upper(owner.name)"));
        assertEquals(ExprType.INT, infer("round(1.5)"));
        assertEquals(ExprType.FLOAT, infer("round(1.55, 1)"));
        assertEquals(ExprType.MONEY, infer("coalesce(null, price)"));
        assertEquals(ExprType.ANY, infer("mystery(1)"));
    }

    @Test
    @DisplayName("Unknown fields are ANY")
    void testUnknownField() {
        assertEquals(ExprType.ANY, infer("nobody_knows"));
        assertEquals(ExprType.ANY, ExpressionTypeChecker.inferType(ExpressionParser.parseExpr("quantity")));
    }
}
