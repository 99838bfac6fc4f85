package work.lcod.yamlfmt.model;

import java.util.Objects;

/**
 * Reference to an anchored node ({@code *name}). The tree stores the name only, never the
 * referenced node, so ownership stays a tree.
 */
public final class AliasNode extends Node {
    private final String target;

    public AliasNode(String target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ALIAS;
    }

    public String target() {
        return target;
    }

    @Override
    public Object toJava() {
        return "*" + target;
    }
}
