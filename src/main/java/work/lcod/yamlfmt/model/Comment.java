package work.lcod.yamlfmt.model;

/**
 * Comment text attached to a node.
 *
 * <p>A pre comment is a run of {@code \n}-terminated lines (a blank line is a bare {@code \n}).
 * A post comment starts with the end-of-line comment text (possibly empty), followed by the line
 * terminator and any blank or full-line comment lines that trail the node. Lines keep their
 * source indentation; {@code column} is the column of the end-of-line comment marker.
 */
public record Comment(String value, int column) {
    public Comment {
        value = value == null ? "" : value;
        column = Math.max(column, 0);
    }

    public static Comment of(String value) {
        return new Comment(value, 0);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public Comment withValue(String newValue) {
        return new Comment(newValue, column);
    }

    public Comment append(String more) {
        return new Comment(value + more, column);
    }
}
