package work.lcod.yamlfmt.model;

/**
 * Resolved type of a scalar. {@link #OTHER} covers explicit tags the formatter does not interpret
 * (for example {@code !vault} or {@code !!binary}); their text is kept as-is.
 */
public enum ScalarType {
    NULL,
    BOOL,
    INT,
    FLOAT,
    STR,
    OTHER
}
