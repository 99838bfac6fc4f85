package work.lcod.yamlfmt.emit;

/**
 * Kind of the emitter event a comment is written in front of.
 */
public enum EventKind {
    SCALAR,
    COLLECTION_START,
    COLLECTION_END,
    DOCUMENT_END,
    STREAM_END;

    /**
     * Boundary events write a line break of their own, so a blank comment in front of them
     * still carries a line.
     */
    public boolean isBoundary() {
        return this == COLLECTION_END || this == DOCUMENT_END || this == STREAM_END;
    }
}
