package org.dazzle.dsl;

import org.dazzle.dsl.Token.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for DSL source text.
 *
 * In layout mode (whole files) indentation is significant: the lexer emits
 * NEWLINE at the end of each logical line and INDENT/DEDENT when the leading
 * whitespace grows or shrinks. Blank lines, {@code #} comments and line
 * breaks inside brackets produce no layout tokens.
 *
 * In expression mode (a single guard or invariant) line breaks are plain
 * whitespace.
 */
public final class DslLexer {

    /** Unit suffixes accepted in compact durations such as {@code 7d}. */
    static final Set<String> DURATION_SUFFIXES = Set.of("d", "h", "w", "m", "y", "min");

    private final String input;
    private final String file;
    private final boolean layout;

    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int position;
    private int line = 1;
    private int lineStart;
    private int bracketDepth;
    private boolean atLineStart = true;

    public DslLexer(String input) {
        this(input, null, true);
    }

    public DslLexer(String input, String file) {
        this(input, file, true);
    }

    private DslLexer(String input, String file, boolean layout) {
        this.input = input;
        this.file = file;
        this.layout = layout;
        this.indents.push(0);
    }

    /**
     * Tokenizes a standalone expression; line breaks are ignored.
     */
    public static List<Token> tokenizeExpression(String expression) {
        return new DslLexer(expression, null, false).tokenize();
    }

    /**
     * Tokenizes the entire input.
     *
     * @return List of tokens, ending with EOF
     */
    public List<Token> tokenize() {
        while (position < input.length()) {
            if (layout && atLineStart && bracketDepth == 0) {
                readIndentation();
                continue;
            }
            char c = input.charAt(position);
            if (c == '\n') {
                endLine();
                continue;
            }
            if (Character.isWhitespace(c)) {
                position++;
                continue;
            }
            if (c == '#') {
                skipComment();
                continue;
            }
            tokens.add(nextToken());
        }

        if (layout) {
            if (!tokens.isEmpty() && last().type() != TokenType.NEWLINE) {
                tokens.add(new Token(TokenType.NEWLINE, null, line, column()));
            }
            while (indents.peek() > 0) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, null, line, column()));
            }
        }
        tokens.add(new Token(TokenType.EOF, null, line, column()));
        return tokens;
    }

    // ==================== Layout ====================

    private void readIndentation() {
        int width = 0;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                throw error("Tabs are not allowed for indentation; use spaces");
            } else if (c != '\r') {
                break;
            }
            position++;
        }
        atLineStart = false;

        // Blank and comment-only lines do not affect indentation
        if (position >= input.length() || input.charAt(position) == '\n' || input.charAt(position) == '#') {
            return;
        }

        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, null, line, column()));
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, null, line, column()));
            }
            if (indents.peek() != width) {
                throw error("Inconsistent indentation: dedent to column " + (width + 1)
                        + " does not match any outer block");
            }
        }
    }

    private void endLine() {
        if (layout && bracketDepth == 0 && !tokens.isEmpty()
                && last().type() != TokenType.NEWLINE
                && last().type() != TokenType.INDENT
                && last().type() != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, null, line, column()));
        }
        position++;
        line++;
        lineStart = position;
        atLineStart = bracketDepth == 0;
    }

    private void skipComment() {
        while (position < input.length() && input.charAt(position) != '\n') {
            position++;
        }
    }

    // ==================== Tokens ====================

    private Token nextToken() {
        char c = input.charAt(position);
        int startColumn = column();

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            TokenType twoCharType = switch (twoChar) {
                case "->" -> TokenType.ARROW;
                case "==" -> TokenType.EQUALS;
                case "!=" -> TokenType.NOT_EQUALS;
                case "<=" -> TokenType.LESS_THAN_EQ;
                case ">=" -> TokenType.GREATER_THAN_EQ;
                default -> null;
            };
            if (twoCharType != null) {
                position += 2;
                return new Token(twoCharType, twoChar, line, startColumn);
            }
        }

        // Single-character operators and delimiters
        TokenType singleCharType = switch (c) {
            case '.' -> TokenType.DOT;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '<' -> TokenType.LESS_THAN;
            case '>' -> TokenType.GREATER_THAN;
            case '=' -> TokenType.ASSIGN;
            case '?' -> TokenType.QUESTION;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case ':' -> TokenType.COLON;
            default -> null;
        };
        if (singleCharType != null) {
            if (c == '(' || c == '[') {
                bracketDepth++;
            } else if ((c == ')' || c == ']') && bracketDepth > 0) {
                bracketDepth--;
            }
            position++;
            return new Token(singleCharType, String.valueOf(c), line, startColumn);
        }

        if (c == '"' || c == '\'') {
            return readString(c);
        }
        if (Character.isDigit(c)) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return readIdentifier();
        }

        throw error("Unexpected character: '" + c + "'");
    }

    private Token readString(char quote) {
        int startColumn = column();
        position++; // opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length() && input.charAt(position) != quote) {
            char c = input.charAt(position);
            if (c == '\n') {
                break;
            }
            if (c == '\\' && position + 1 < input.length()) {
                position++;
                c = input.charAt(position);
                sb.append(switch (c) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> c;
                });
            } else {
                sb.append(c);
            }
            position++;
        }

        if (position >= input.length() || input.charAt(position) != quote) {
            throw new DslParseException("Unterminated string literal", file, line, startColumn);
        }
        position++; // closing quote
        return new Token(TokenType.STRING, sb.toString(), line, startColumn);
    }

    private Token readNumber() {
        int start = position;
        int startColumn = column();
        boolean decimal = false;

        while (position < input.length() && Character.isDigit(input.charAt(position))) {
            position++;
        }
        if (position + 1 < input.length() && input.charAt(position) == '.'
                && Character.isDigit(input.charAt(position + 1))) {
            decimal = true;
            position++;
            while (position < input.length() && Character.isDigit(input.charAt(position))) {
                position++;
            }
        }

        String digits = input.substring(start, position);
        if (position < input.length() && Character.isLetter(input.charAt(position))) {
            int suffixStart = position;
            while (position < input.length() && Character.isLetterOrDigit(input.charAt(position))) {
                position++;
            }
            String suffix = input.substring(suffixStart, position);
            if (!decimal && DURATION_SUFFIXES.contains(suffix)) {
                return new Token(TokenType.DURATION, digits + suffix, line, startColumn);
            }
            throw new DslParseException("Invalid number literal: '" + digits + suffix + "'", file, line, startColumn);
        }
        return new Token(decimal ? TokenType.DECIMAL : TokenType.INTEGER, digits, line, startColumn);
    }

    private Token readIdentifier() {
        int start = position;
        int startColumn = column();
        while (position < input.length()
                && (Character.isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, position), line, startColumn);
    }

    // ==================== Helpers ====================

    private Token last() {
        return tokens.get(tokens.size() - 1);
    }

    private int column() {
        return position - lineStart + 1;
    }

    private DslParseException error(String message) {
        return new DslParseException(message, file, line, column());
    }
}
