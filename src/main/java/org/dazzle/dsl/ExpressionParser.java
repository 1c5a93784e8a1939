package org.dazzle.dsl;

import org.dazzle.dsl.Token.TokenType;
import org.dazzle.dsl.expression.BinaryExpr;
import org.dazzle.dsl.expression.BinaryOp;
import org.dazzle.dsl.expression.DurationLiteral;
import org.dazzle.dsl.expression.Expr;
import org.dazzle.dsl.expression.FieldRef;
import org.dazzle.dsl.expression.FuncCall;
import org.dazzle.dsl.expression.IfExpr;
import org.dazzle.dsl.expression.InExpr;
import org.dazzle.dsl.expression.Literal;
import org.dazzle.dsl.expression.UnaryExpr;
import org.dazzle.dsl.expression.UnaryOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the expression language used by guards,
 * computed fields and invariants.
 *
 * Precedence (lowest to highest):
 * 1. or
 * 2. and
 * 3. not
 * 4. comparison (== != < > <= >=), is [not] null, [not] in
 * 5. additive (+ -)
 * 6. multiplicative (* / %)
 * 7. unary minus
 * 8. atoms
 *
 * Invariants use a narrower grammar (see {@link #parseInvariantExpression()}).
 */
public class ExpressionParser extends TokenParser {

    static final Set<String> RESERVED = Set.of(
            "and", "or", "not", "in", "is", "if", "elif", "else", "true", "false", "null");

    static final Set<String> DURATION_UNITS = Set.of(
            "d", "h", "w", "m", "y", "min", "mins", "hr", "hrs",
            "day", "days", "hour", "hours", "minute", "minutes",
            "week", "weeks", "month", "months", "year", "years");

    protected ExpressionParser(List<Token> tokens, String file) {
        super(tokens, file);
    }

    /**
     * Parses a complete standalone expression.
     *
     * @throws DslParseException if the text is not a single well-formed expression
     */
    public static Expr parseExpr(String expression) {
        ExpressionParser parser = new ExpressionParser(DslLexer.tokenizeExpression(expression), null);
        Expr expr = parser.parseExpression();
        parser.expectEnd();
        return expr;
    }

    /**
     * Parses a complete standalone invariant expression.
     */
    public static Expr parseInvariantExpr(String expression) {
        ExpressionParser parser = new ExpressionParser(DslLexer.tokenizeExpression(expression), null);
        Expr expr = parser.parseInvariantExpression();
        parser.expectEnd();
        return expr;
    }

    private void expectEnd() {
        if (!isAtEnd()) {
            throw error("Unexpected token " + describe(peek()) + " after expression");
        }
    }

    // ==================== Full expression grammar ====================

    protected Expr parseExpression() {
        return parseOr();
    }

    private Expr parseOr() {
        Expr left = parseAnd();
        while (matchWord("or")) {
            left = new BinaryExpr(BinaryOp.OR, left, parseAnd());
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseNot();
        while (matchWord("and")) {
            left = new BinaryExpr(BinaryOp.AND, left, parseNot());
        }
        return left;
    }

    private Expr parseNot() {
        if (checkWord("not") && !peekAhead(1).isWord("in")) {
            advance();
            return new UnaryExpr(UnaryOp.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseAdditive();

        BinaryOp op = comparisonOperator(false);
        if (op != null) {
            advance();
            return new BinaryExpr(op, left, parseAdditive());
        }

        // is null / is not null
        if (matchWord("is")) {
            boolean negated = matchWord("not");
            consumeWord("null");
            return new BinaryExpr(negated ? BinaryOp.NE : BinaryOp.EQ, left, Literal.NULL);
        }

        // in [...] / not in [...]
        if (checkWord("not") && peekAhead(1).isWord("in")) {
            advance();
            advance();
            return parseInList(left, true);
        }
        if (matchWord("in")) {
            return parseInList(left, false);
        }
        return left;
    }

    private Expr parseInList(Expr probe, boolean negated) {
        if (match(TokenType.LBRACKET)) {
            List<Expr> items = parseItems(TokenType.RBRACKET, "']'");
            return new InExpr(probe, items, negated);
        }
        if (match(TokenType.LPAREN)) {
            List<Expr> items = parseItems(TokenType.RPAREN, "')'");
            return new InExpr(probe, List.of(new FuncCall(FuncCall.LIST_CONSTRUCTOR, items)), negated);
        }
        throw error("Expected '[' or '(' after 'in'");
    }

    private List<Expr> parseItems(TokenType close, String closeText) {
        List<Expr> items = new ArrayList<>();
        if (!check(close)) {
            do {
                items.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        consume(close, "Expected " + closeText);
        return items;
    }

    private Expr parseAdditive() {
        Expr left = parseMultiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOp op = advance().type() == TokenType.PLUS ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(op, left, parseMultiplicative());
        }
        return left;
    }

    private Expr parseMultiplicative() {
        Expr left = parseUnary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            BinaryOp op = switch (advance().type()) {
                case STAR -> BinaryOp.MUL;
                case SLASH -> BinaryOp.DIV;
                default -> BinaryOp.MOD;
            };
            left = new BinaryExpr(op, left, parseUnary());
        }
        return left;
    }

    private Expr parseUnary() {
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryOp.NEG, parseUnary());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = peek();

        if (match(TokenType.LPAREN)) {
            Expr inner = parseExpression();
            consume(TokenType.RPAREN, "Expected ')'");
            return inner;
        }
        if (match(TokenType.LBRACKET)) {
            return new FuncCall(FuncCall.LIST_CONSTRUCTOR, parseItems(TokenType.RBRACKET, "']'"));
        }
        Expr literal = parseLiteral();
        if (literal != null) {
            return literal;
        }
        if (token.isWord("if")) {
            advance();
            return parseIf();
        }
        if (token.is(TokenType.IDENTIFIER) && !RESERVED.contains(token.value())) {
            if (peekAhead(1).is(TokenType.LPAREN)) {
                advance();
                advance();
                return new FuncCall(token.value(), parseItems(TokenType.RPAREN, "')'"));
            }
            return parseFieldPath();
        }
        if (token.is(TokenType.EOF)) {
            throw error("Expected expression, found end of input");
        }
        throw error("Unexpected token " + describe(token) + " in expression");
    }

    /**
     * if cond: value (elif cond: value)* else: value
     */
    private Expr parseIf() {
        Expr condition = parseExpression();
        consume(TokenType.COLON, "Expected ':' after if condition");
        Expr thenExpr = parseExpression();

        List<IfExpr.ElifBranch> branches = new ArrayList<>();
        while (matchWord("elif")) {
            Expr elifCondition = parseExpression();
            consume(TokenType.COLON, "Expected ':' after elif condition");
            branches.add(new IfExpr.ElifBranch(elifCondition, parseExpression()));
        }

        if (!matchWord("else")) {
            throw error("Expected 'else' branch in if expression");
        }
        consume(TokenType.COLON, "Expected ':' after else");
        return new IfExpr(condition, thenExpr, branches, parseExpression());
    }

    // ==================== Invariant grammar ====================

    /**
     * Parses an invariant: boolean combinations of single comparisons
     * between field paths, literals, durations and today/now date terms.
     * Both {@code =} and {@code ==} mean equality here.
     */
    protected Expr parseInvariantExpression() {
        Expr left = parseInvariantAnd();
        while (matchWord("or")) {
            left = new BinaryExpr(BinaryOp.OR, left, parseInvariantAnd());
        }
        return left;
    }

    private Expr parseInvariantAnd() {
        Expr left = parseInvariantNot();
        while (matchWord("and")) {
            left = new BinaryExpr(BinaryOp.AND, left, parseInvariantNot());
        }
        return left;
    }

    private Expr parseInvariantNot() {
        if (matchWord("not")) {
            return new UnaryExpr(UnaryOp.NOT, parseInvariantNot());
        }
        return parseInvariantComparison();
    }

    private Expr parseInvariantComparison() {
        Expr left = parseInvariantPrimary();
        BinaryOp op = comparisonOperator(true);
        if (op != null) {
            advance();
            return new BinaryExpr(op, left, parseInvariantPrimary());
        }
        return left;
    }

    private Expr parseInvariantPrimary() {
        Token token = peek();

        if (match(TokenType.LPAREN)) {
            Expr inner = parseInvariantExpression();
            consume(TokenType.RPAREN, "Expected ')'");
            return inner;
        }

        // today / now, optionally shifted by a duration
        if (token.isWord("today") || token.isWord("now")) {
            advance();
            if (match(TokenType.LPAREN)) {
                consume(TokenType.RPAREN, "Expected ')'");
            }
            Expr date = new FuncCall(token.value(), List.of());
            if (check(TokenType.PLUS) || check(TokenType.MINUS)) {
                BinaryOp op = advance().type() == TokenType.PLUS ? BinaryOp.ADD : BinaryOp.SUB;
                Expr duration = parseLiteral();
                if (!(duration instanceof DurationLiteral)) {
                    throw error("Expected duration after '" + token.value() + " " + op.symbol() + "'");
                }
                return new BinaryExpr(op, date, duration);
            }
            return date;
        }

        if (token.isWord("None")) {
            advance();
            return Literal.NULL;
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryOp.NEG, parseInvariantPrimary());
        }
        Expr literal = parseLiteral();
        if (literal != null) {
            return literal;
        }
        if (token.is(TokenType.IDENTIFIER) && !RESERVED.contains(token.value())) {
            return parseFieldPath();
        }
        throw error("Unexpected token " + describe(token) + " in invariant");
    }

    // ==================== Shared atoms ====================

    /**
     * Parses a literal or duration at the cursor, or returns null without
     * consuming anything.
     */
    private Expr parseLiteral() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER: {
                advance();
                long value = parseLong(token);
                Token next = peek();
                if (next.is(TokenType.IDENTIFIER) && DURATION_UNITS.contains(next.value())
                        && next.line() == token.line()) {
                    advance();
                    return new DurationLiteral(value, next.value());
                }
                return new Literal(value);
            }
            case DECIMAL:
                advance();
                return new Literal(Double.parseDouble(token.value()));
            case DURATION: {
                advance();
                String text = token.value();
                int split = 0;
                while (split < text.length() && Character.isDigit(text.charAt(split))) {
                    split++;
                }
                return new DurationLiteral(parseLong(token, text.substring(0, split)), text.substring(split));
            }
            case STRING:
                advance();
                return new Literal(token.value());
            case IDENTIFIER:
                if (token.value().equals("true")) {
                    advance();
                    return Literal.TRUE;
                }
                if (token.value().equals("false")) {
                    advance();
                    return Literal.FALSE;
                }
                if (token.value().equals("null")) {
                    advance();
                    return Literal.NULL;
                }
                return null;
            default:
                return null;
        }
    }

    protected long parseLong(Token token) {
        return parseLong(token, token.value());
    }

    /**
     * @param digits The numeric part of {@code token}, reported on overflow
     */
    protected long parseLong(Token token, String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + digits, token);
        }
    }

    /**
     * Parses {@code a.b->c.d} into one flattened path.
     */
    protected FieldRef parseFieldPath() {
        List<String> path = new ArrayList<>();
        path.add(consumeIdentifier("field name"));
        while (check(TokenType.DOT) || check(TokenType.ARROW)) {
            advance();
            path.add(consumeIdentifier("field name after '.' or '->'"));
        }
        return new FieldRef(path);
    }

    private BinaryOp comparisonOperator(boolean allowSingleEquals) {
        return switch (peek().type()) {
            case EQUALS -> BinaryOp.EQ;
            case ASSIGN -> allowSingleEquals ? BinaryOp.EQ : null;
            case NOT_EQUALS -> BinaryOp.NE;
            case LESS_THAN -> BinaryOp.LT;
            case GREATER_THAN -> BinaryOp.GT;
            case LESS_THAN_EQ -> BinaryOp.LE;
            case GREATER_THAN_EQ -> BinaryOp.GE;
            default -> null;
        };
    }
}
