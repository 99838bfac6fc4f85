package work.lcod.yamlfmt.model;

import java.util.List;
import java.util.Map;

/**
 * Shared shape of mappings and sequences: an ordered key/value view where sequence indices act
 * as keys, so tree walks need not switch on the collection kind.
 */
public abstract class CollectionNode extends Node {
    private boolean flow;

    public boolean isFlow() {
        return flow;
    }

    public void setFlow(boolean flow) {
        this.flow = flow;
    }

    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Snapshot of the children in document order; mapping keys are plain Java key values.
     */
    public abstract List<Map.Entry<Object, Node>> children();
}
