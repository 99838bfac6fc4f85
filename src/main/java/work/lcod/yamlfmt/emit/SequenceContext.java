package work.lcod.yamlfmt.emit;

/**
 * Position of a block sequence being emitted.
 *
 * @param root whether the sequence is the document root
 * @param depth number of enclosing collections
 */
public record SequenceContext(boolean root, int depth) {}
