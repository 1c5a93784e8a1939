package org.dazzle.dsl.expression;

/**
 * A constant value: string, integral number (Long), decimal number (Double),
 * boolean, or null.
 *
 * @param value The literal value, may be null
 */
public record Literal(Object value) implements Expr {

    public static final Literal NULL = new Literal(null);
    public static final Literal TRUE = new Literal(Boolean.TRUE);
    public static final Literal FALSE = new Literal(Boolean.FALSE);

    public static Literal of(Object value) {
        return new Literal(value);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        return value.toString();
    }

    /**
     * Double-quotes a string using the escapes the lexer reads back.
     */
    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
