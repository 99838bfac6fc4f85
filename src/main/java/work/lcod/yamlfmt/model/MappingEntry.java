package work.lcod.yamlfmt.model;

import java.util.Objects;

/**
 * One key/value pair of a {@link MappingNode}. The key node holds the comments that precede
 * the entry; the value may be replaced in place.
 */
public final class MappingEntry {
    private final Node key;
    private Node value;

    public MappingEntry(Node key, Node value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Node key() {
        return key;
    }

    public Node value() {
        return value;
    }

    public void setValue(Node value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Java value of the key used for lookups and traversal paths.
     */
    public Object keyValue() {
        return key.toJava();
    }
}
