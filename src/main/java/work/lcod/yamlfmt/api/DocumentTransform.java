package work.lcod.yamlfmt.api;

import work.lcod.yamlfmt.model.Document;

/**
 * In-place edit applied to a loaded document before it is dumped again (an auto-fix, for
 * instance).
 */
@FunctionalInterface
public interface DocumentTransform {
    void apply(Document document);
}
