package work.lcod.yamlfmt.model;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered sequence node.
 */
public final class SequenceNode extends CollectionNode {
    private final List<Node> items = new ArrayList<>();

    @Override
    public NodeKind kind() {
        return NodeKind.SEQUENCE;
    }

    public List<Node> items() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public int size() {
        return items.size();
    }

    public Node get(int index) {
        return items.get(index);
    }

    public void add(Node item) {
        items.add(Objects.requireNonNull(item, "item"));
    }

    public void add(Object value) {
        add(value instanceof Node node ? node : ScalarNode.of(value));
    }

    public void add(int index, Node item) {
        items.add(index, Objects.requireNonNull(item, "item"));
    }

    public Node set(int index, Node item) {
        return items.set(index, Objects.requireNonNull(item, "item"));
    }

    public Node remove(int index) {
        return items.remove(index);
    }

    @Override
    public List<Map.Entry<Object, Node>> children() {
        var children = new ArrayList<Map.Entry<Object, Node>>(items.size());
        for (int i = 0; i < items.size(); i++) {
            children.add(new AbstractMap.SimpleImmutableEntry<>(i, items.get(i)));
        }
        return children;
    }

    @Override
    public Object toJava() {
        var list = new ArrayList<Object>(items.size());
        for (var item : items) {
            list.add(item.toJava());
        }
        return list;
    }
}
