package work.lcod.yamlfmt.model;

/**
 * Base of the document tree. Every node may carry an anchor, an explicit tag and the comments
 * attached to it. Nodes form a tree: a node is owned by exactly one parent.
 */
public abstract class Node {
    private String anchor;
    private String tag;
    private Comment pre;
    private Comment post;

    public abstract NodeKind kind();

    /**
     * Plain Java view of this node (maps, lists, typed scalars).
     */
    public abstract Object toJava();

    public String anchor() {
        return anchor;
    }

    public void setAnchor(String anchor) {
        this.anchor = anchor;
    }

    /**
     * Explicit tag as written in the source ({@code !vault}, {@code tag:yaml.org,2002:str}), or
     * {@code null} when the tag was implicit.
     */
    public String tag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public Comment pre() {
        return pre;
    }

    public void setPre(Comment pre) {
        this.pre = pre;
    }

    public Comment post() {
        return post;
    }

    public void setPost(Comment post) {
        this.post = post;
    }

    public boolean isScalar() {
        return kind() == NodeKind.SCALAR;
    }

    public boolean isCollection() {
        return kind() == NodeKind.MAPPING || kind() == NodeKind.SEQUENCE;
    }
}
