package work.lcod.yamlfmt.traverse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One step of a {@link NestedItems} walk.
 *
 * @param key mapping key or sequence index of the value
 * @param value the value itself (a node or a plain Java value, matching the walked tree)
 * @param parentPath keys and indices from the root down to the value's container
 */
public record NestedItem(Object key, Object value, List<Object> parentPath) {
    public NestedItem {
        parentPath = Collections.unmodifiableList(new ArrayList<>(parentPath));
    }
}
