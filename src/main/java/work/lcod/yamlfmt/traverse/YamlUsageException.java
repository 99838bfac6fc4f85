package work.lcod.yamlfmt.traverse;

/**
 * Raised when a caller hands the traversal a value that is neither a mapping nor a sequence.
 */
public final class YamlUsageException extends IllegalArgumentException {
    public YamlUsageException(String message) {
        super(message);
    }

    static YamlUsageException unexpected(Object value) {
        String type = value == null ? "null" : value.getClass().getName();
        return new YamlUsageException("Expected a mapping or a sequence but got " + value + " of type " + type);
    }
}
