package work.lcod.yamlfmt.load;

/**
 * Raised when the input is not well-formed YAML or a typed literal does not parse under the
 * active version. Line and column are 1-based, or 0 when unknown.
 */
public final class YamlParseException extends RuntimeException {
    private final int line;
    private final int column;

    public YamlParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public YamlParseException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
