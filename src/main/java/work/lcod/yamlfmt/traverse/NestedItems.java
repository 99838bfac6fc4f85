package work.lcod.yamlfmt.traverse;

import java.time.temporal.TemporalAccessor;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import work.lcod.yamlfmt.model.AliasNode;
import work.lcod.yamlfmt.model.CollectionNode;
import work.lcod.yamlfmt.model.ScalarNode;

/**
 * Lazy pre-order walk over nested mappings and sequences, yielding every entry with the path of
 * its container. Works on document nodes as well as on plain {@code Map}/{@code List} trees.
 * The walk never modifies the tree and can be restarted by calling it again.
 */
public final class NestedItems {
    private NestedItems() {}

    /**
     * @throws YamlUsageException when {@code root} is not a mapping or a sequence
     */
    public static Iterable<NestedItem> iterable(Object root) {
        if (!isContainer(root)) {
            throw YamlUsageException.unexpected(root);
        }
        return () -> new Walker(root);
    }

    public static Stream<NestedItem> stream(Object root) {
        return StreamSupport.stream(iterable(root).spliterator(), false);
    }

    private static boolean isContainer(Object value) {
        return value instanceof CollectionNode || value instanceof Map || value instanceof List;
    }

    private static boolean isScalar(Object value) {
        return value == null
            || value instanceof ScalarNode
            || value instanceof AliasNode
            || value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof TemporalAccessor
            || value instanceof Date;
    }

    @SuppressWarnings("unchecked")
    private static Iterator<Map.Entry<Object, Object>> children(Object container) {
        if (container instanceof CollectionNode collection) {
            var entries = new ArrayList<Map.Entry<Object, Object>>();
            for (var child : collection.children()) {
                entries.add(new AbstractMap.SimpleImmutableEntry<>(child.getKey(), child.getValue()));
            }
            return entries.iterator();
        }
        if (container instanceof Map<?, ?> map) {
            return ((Map<Object, Object>) map).entrySet().iterator();
        }
        var list = (List<Object>) container;
        var entries = new ArrayList<Map.Entry<Object, Object>>(list.size());
        for (int i = 0; i < list.size(); i++) {
            entries.add(new AbstractMap.SimpleImmutableEntry<>(i, list.get(i)));
        }
        return entries.iterator();
    }

    private record Frame(Iterator<Map.Entry<Object, Object>> children, List<Object> path) {}

    private static final class Walker implements Iterator<NestedItem> {
        private final Deque<Frame> stack = new ArrayDeque<>();

        Walker(Object root) {
            stack.push(new Frame(children(root), List.of()));
        }

        @Override
        public boolean hasNext() {
            while (!stack.isEmpty() && !stack.peek().children().hasNext()) {
                stack.pop();
            }
            return !stack.isEmpty();
        }

        @Override
        public NestedItem next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Frame frame = stack.peek();
            var entry = frame.children().next();
            Object value = entry.getValue();
            var item = new NestedItem(entry.getKey(), value, frame.path());
            if (isContainer(value)) {
                var path = new ArrayList<>(frame.path());
                path.add(entry.getKey());
                stack.push(new Frame(children(value), path));
            } else if (!isScalar(value)) {
                throw YamlUsageException.unexpected(value);
            }
            return item;
        }
    }
}
