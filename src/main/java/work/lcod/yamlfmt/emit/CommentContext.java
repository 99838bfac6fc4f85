package work.lcod.yamlfmt.emit;

/**
 * Where a comment is about to be written.
 *
 * @param event event that follows the comment
 * @param pre whether the comment is a pre comment (otherwise it trails a node)
 * @param indent column of the entries of the innermost open collection
 * @param cursorColumn column of the write cursor
 */
public record CommentContext(EventKind event, boolean pre, int indent, int cursorColumn) {}
