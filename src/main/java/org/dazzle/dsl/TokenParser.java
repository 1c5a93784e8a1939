package org.dazzle.dsl;

import org.dazzle.dsl.Token.TokenType;

import java.util.List;

/**
 * Cursor over a token list with the lookahead helpers shared by the
 * expression and declaration parsers.
 */
abstract class TokenParser {

    protected final List<Token> tokens;
    protected final String file;
    protected int position;

    protected TokenParser(List<Token> tokens, String file) {
        this.tokens = tokens;
        this.file = file;
        this.position = 0;
    }

    // ==================== Helper methods ====================

    protected Token peek() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    protected Token peekAhead(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    protected boolean check(TokenType type) {
        return peek().type() == type;
    }

    protected boolean checkWord(String word) {
        return peek().isWord(word);
    }

    protected boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    protected Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            position++;
        }
        return token;
    }

    protected boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean matchWord(String word) {
        if (checkWord(word)) {
            advance();
            return true;
        }
        return false;
    }

    protected Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message + ", found " + describe(peek()));
    }

    protected Token consumeWord(String word) {
        if (checkWord(word)) {
            return advance();
        }
        throw error("Expected '" + word + "', found " + describe(peek()));
    }

    protected String consumeIdentifier(String what) {
        return consume(TokenType.IDENTIFIER, "Expected " + what).value();
    }

    protected DslParseException error(String message) {
        return error(message, peek());
    }

    protected DslParseException error(String message, Token at) {
        return new DslParseException(message, file, at.line(), at.column());
    }

    protected static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            case INDENT -> "indented block";
            case DEDENT -> "end of block";
            case STRING -> "string \"" + token.value() + "\"";
            default -> "'" + token.value() + "'";
        };
    }
}
