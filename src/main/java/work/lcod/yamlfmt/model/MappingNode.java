package work.lcod.yamlfmt.model;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mapping node keeping insertion order of its entries.
 */
public final class MappingNode extends CollectionNode {
    private final List<MappingEntry> entries = new ArrayList<>();

    @Override
    public NodeKind kind() {
        return NodeKind.MAPPING;
    }

    public List<MappingEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public int size() {
        return entries.size();
    }

    public Optional<MappingEntry> entry(Object key) {
        for (var entry : entries) {
            if (Objects.equals(entry.keyValue(), key)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public Node get(Object key) {
        return entry(key).map(MappingEntry::value).orElse(null);
    }

    public boolean containsKey(Object key) {
        return entry(key).isPresent();
    }

    /**
     * Replaces the value of an existing key (keeping the key node and its comments) or appends a
     * new entry with a plain scalar key.
     */
    public void put(String key, Node value) {
        var existing = entry(key);
        if (existing.isPresent()) {
            existing.get().setValue(value);
            return;
        }
        entries.add(new MappingEntry(ScalarNode.of(key), value));
    }

    public void put(String key, Object value) {
        put(key, value instanceof Node node ? node : ScalarNode.of(value));
    }

    public void add(Node key, Node value) {
        entries.add(new MappingEntry(key, value));
    }

    public void add(int index, Node key, Node value) {
        entries.add(index, new MappingEntry(key, value));
    }

    public Node remove(Object key) {
        for (int i = 0; i < entries.size(); i++) {
            if (Objects.equals(entries.get(i).keyValue(), key)) {
                return entries.remove(i).value();
            }
        }
        return null;
    }

    @Override
    public List<Map.Entry<Object, Node>> children() {
        var children = new ArrayList<Map.Entry<Object, Node>>(entries.size());
        for (var entry : entries) {
            children.add(new AbstractMap.SimpleImmutableEntry<>(entry.keyValue(), entry.value()));
        }
        return children;
    }

    @Override
    public Object toJava() {
        var map = new LinkedHashMap<Object, Object>();
        for (var entry : entries) {
            map.put(entry.keyValue(), entry.value().toJava());
        }
        return map;
    }
}
