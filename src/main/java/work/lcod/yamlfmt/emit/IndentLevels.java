package work.lcod.yamlfmt.emit;

/**
 * Indentation of a block sequence: item content sits {@code indent} columns in from the parent,
 * the dash {@code dashOffset} columns in.
 */
public record IndentLevels(int indent, int dashOffset) {
    public static final IndentLevels FLUSH = new IndentLevels(2, 0);
    public static final IndentLevels INDENTED = new IndentLevels(4, 2);

    public IndentLevels {
        if (dashOffset < 0 || dashOffset + 2 > indent) {
            throw new IllegalArgumentException("dash offset " + dashOffset + " does not fit indent " + indent);
        }
    }
}
