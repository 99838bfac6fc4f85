package work.lcod.yamlfmt.model;

/**
 * Presentation style of a scalar. Quote styles are advisory on dump, block styles are kept.
 */
public enum ScalarStyle {
    PLAIN,
    SINGLE_QUOTED,
    DOUBLE_QUOTED,
    LITERAL,
    FOLDED;

    public boolean isBlock() {
        return this == LITERAL || this == FOLDED;
    }
}
