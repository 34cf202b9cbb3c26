package io.surfworks.qaeforge.quil;

/**
 * Exception thrown while reading Quil program text.
 */
public class QuilParseException extends RuntimeException {

    private final int line;
    private final int column;

    public QuilParseException(String message, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
        this.line = line;
        this.column = column;
    }

    public QuilParseException(String message, int line, int column, Throwable cause) {
        super(String.format("%s at line %d, column %d", message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
