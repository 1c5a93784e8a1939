package org.dazzle.dsl;

/**
 * Represents a token produced by {@link DslLexer}.
 *
 * @param type   The token type
 * @param value  The token text (identifier, literal value, operator)
 * @param line   1-based source line
 * @param column 1-based source column
 */
public record Token(TokenType type, String value, int line, int column) {

    public enum TokenType {
        // Identifiers and literals
        IDENTIFIER, // entity, status, my_field
        STRING, // "hello" or 'hello'
        INTEGER, // 42
        DECIMAL, // 3.14
        DURATION, // 7d, 30min

        // Operators
        ARROW, // ->
        DOT, // .
        PLUS, // +
        MINUS, // -
        STAR, // *
        SLASH, // /
        PERCENT, // %
        EQUALS, // ==
        NOT_EQUALS, // !=
        LESS_THAN, // <
        LESS_THAN_EQ, // <=
        GREATER_THAN, // >
        GREATER_THAN_EQ, // >=
        ASSIGN, // =
        QUESTION, // ?

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        COMMA, // ,
        COLON, // :

        // Layout
        NEWLINE,
        INDENT,
        DEDENT,
        EOF,
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * True for an identifier spelled exactly {@code word}.
     */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && word.equals(value);
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + line + ":" + column;
    }
}
