package work.lcod.yamlfmt.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ScalarStylesTest {
    @Test
    void plainRejectsIndicators() {
        assertTrue(ScalarStyles.plainAllowed("value", ScalarStyles.Context.BLOCK));
        assertTrue(ScalarStyles.plainAllowed("-x", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed("- x", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed("a: b", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed("a #b", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed("*ref", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed(" lead", ScalarStyles.Context.BLOCK));
    }

    @Test
    void flowRejectsFlowIndicators() {
        assertTrue(ScalarStyles.plainAllowed("a,b", ScalarStyles.Context.BLOCK));
        assertFalse(ScalarStyles.plainAllowed("a,b", ScalarStyles.Context.FLOW));
    }

    @Test
    void escapesDoubleQuotedText() {
        assertEquals("\"a\\tb\\x01\\\"\"", ScalarStyles.doubleQuoted("a\tb\u0001\""));
        assertEquals("'it''s'", ScalarStyles.singleQuoted("it's"));
    }

    @Test
    void blockNeedsVisibleContent() {
        assertTrue(ScalarStyles.fitsBlock("a\n\nb\n"));
        assertFalse(ScalarStyles.fitsBlock("\n\n"));
        assertFalse(ScalarStyles.fitsBlock("a\n  \nb"));
    }

    @Test
    void shortensTags() {
        assertEquals("!!str", ScalarStyles.tag("tag:yaml.org,2002:str"));
        assertEquals("!vault", ScalarStyles.tag("!vault"));
        assertEquals("!<tag:example.com,2024:x>", ScalarStyles.tag("tag:example.com,2024:x"));
    }
}
