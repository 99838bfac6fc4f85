package work.lcod.yamlfmt.traverse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.yamlfmt.api.FormattedYaml;
import work.lcod.yamlfmt.model.ScalarNode;

class NestedItemsTest {
    private static final String SOURCE = "a: 1\nb:\n  c: [x, y]\n  d: 2\nlist:\n  - e\n  - f: 3\n";

    private final FormattedYaml yaml = new FormattedYaml();

    @Test
    void walksDocumentNodesInPreOrder() {
        var items = NestedItems.stream(yaml.load(SOURCE).root()).collect(Collectors.toList());

        assertEquals(10, items.size());
        assertEquals(List.of("a", "b", "c", 0, 1, "d", "list", 0, 1, "f"),
            items.stream().map(NestedItem::key).collect(Collectors.toList()));
        var f = items.get(9);
        assertEquals(List.of("list", 1), f.parentPath());
        assertInstanceOf(ScalarNode.class, f.value());
        assertEquals(List.of("b", "c"), items.get(3).parentPath());
    }

    @Test
    void walksPlainJavaTrees() {
        var items = new ArrayList<NestedItem>();
        NestedItems.iterable(yaml.load(SOURCE).toJava()).forEach(items::add);

        assertEquals(10, items.size());
        assertEquals("x", items.get(3).value());
        assertEquals(List.of("b", "c"), items.get(3).parentPath());
    }

    @Test
    void canBeRestarted() {
        var iterable = NestedItems.iterable(yaml.load(SOURCE).root());
        var first = new ArrayList<NestedItem>();
        var second = new ArrayList<NestedItem>();

        iterable.forEach(first::add);
        iterable.forEach(second::add);

        assertEquals(10, first.size());
        assertEquals(first, second);
    }

    @Test
    void allowsNullKeysAndValues() {
        var map = new LinkedHashMap<Object, Object>();
        map.put(null, Arrays.asList(1, null));

        var items = NestedItems.stream(map).collect(Collectors.toList());

        assertEquals(3, items.size());
        assertEquals(Arrays.asList((Object) null), items.get(1).parentPath());
    }

    @Test
    void rejectsScalarRoot() {
        var ex = assertThrows(YamlUsageException.class, () -> NestedItems.iterable("text"));

        assertTrue(ex.getMessage().contains("java.lang.String"), ex.getMessage());
    }

    @Test
    void rejectsUnsupportedLeaves() {
        var iterator = NestedItems.iterable(Map.of("k", new Object())).iterator();

        assertThrows(YamlUsageException.class, iterator::next);
    }
}
