package work.lcod.yamlfmt.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A loaded YAML document: the root node, the preamble found before {@code ---}, the language
 * version active while parsing, and the comments that sit outside the root node.
 */
public final class Document {
    private Node root;
    private final YamlVersion version;
    private String preamble;
    private Comment pre;
    private Comment end;

    public Document(Node root, YamlVersion version) {
        this.root = Objects.requireNonNull(root, "root");
        this.version = Objects.requireNonNull(version, "version");
    }

    public Node root() {
        return root;
    }

    public void setRoot(Node root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public YamlVersion version() {
        return version;
    }

    /**
     * Raw comment lines (and the blank lines following them) that preceded the document start
     * marker.
     */
    public Optional<String> preamble() {
        return Optional.ofNullable(preamble);
    }

    public void setPreamble(String preamble) {
        this.preamble = preamble == null || preamble.isEmpty() ? null : preamble;
    }

    /**
     * Lines between the document start marker and the root node.
     */
    public Comment pre() {
        return pre;
    }

    public void setPre(Comment pre) {
        this.pre = pre;
    }

    /**
     * Lines after the last content line of the document.
     */
    public Comment end() {
        return end;
    }

    public void setEnd(Comment end) {
        this.end = end;
    }

    public Object toJava() {
        return root.toJava();
    }
}
