package org.dazzle.dsl;

/**
 * Exception thrown when DSL source cannot be tokenized or parsed.
 * Carries the source location for editor and CLI diagnostics.
 */
public class DslParseException extends RuntimeException {

    private final String file;
    private final int line;
    private final int column;

    public DslParseException(String message) {
        super(message);
        this.file = null;
        this.line = -1;
        this.column = -1;
    }

    public DslParseException(String message, int line, int column) {
        this(message, null, line, column);
    }

    public DslParseException(String message, String file, int line, int column) {
        super((file != null ? file + ":" : "") + "line " + line + ":" + column + " " + message);
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
