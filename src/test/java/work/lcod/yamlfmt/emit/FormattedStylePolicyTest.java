package work.lcod.yamlfmt.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.YamlVersion;

class FormattedStylePolicyTest {
    private final FormattedStylePolicy policy = new FormattedStylePolicy('"', true);

    @Test
    void swapsSingleQuotesForDoubleQuotes() {
        assertEquals(ScalarStyle.DOUBLE_QUOTED, policy.chooseScalarStyle(ScalarNode.of("it's"), ScalarStyle.SINGLE_QUOTED));
        assertEquals(ScalarStyle.SINGLE_QUOTED, policy.chooseScalarStyle(ScalarNode.of("say \"hi\""), ScalarStyle.SINGLE_QUOTED));
        assertEquals(ScalarStyle.PLAIN, policy.chooseScalarStyle(ScalarNode.of("plain"), ScalarStyle.PLAIN));
        assertEquals(ScalarStyle.DOUBLE_QUOTED, policy.chooseScalarStyle(ScalarNode.of("a\nb"), ScalarStyle.DOUBLE_QUOTED));
    }

    @Test
    void keepsSingleQuotesWhenPreferred() {
        var single = new FormattedStylePolicy('\'', true);

        assertEquals(ScalarStyle.SINGLE_QUOTED, single.chooseScalarStyle(ScalarNode.of("x y"), ScalarStyle.SINGLE_QUOTED));
    }

    @Test
    void fallsBackToDoubleQuotesForOtherCharacters() {
        var fallback = new FormattedStylePolicy('`', true);

        assertEquals(ScalarStyle.DOUBLE_QUOTED, fallback.chooseScalarStyle(ScalarNode.of("x: y"), ScalarStyle.SINGLE_QUOTED));
    }

    @Test
    void indentsOnlyNestedSequences() {
        assertEquals(IndentLevels.FLUSH, policy.sequenceIndent(new SequenceContext(true, 0)));
        assertEquals(IndentLevels.INDENTED, policy.sequenceIndent(new SequenceContext(false, 1)));
        assertEquals(IndentLevels.FLUSH, new FormattedStylePolicy('"', false).sequenceIndent(new SequenceContext(false, 1)));
    }

    @Test
    void declaresOnlyNewerVersions() {
        assertFalse(policy.writeVersionDirective(YamlVersion.V1_1));
        assertTrue(policy.writeVersionDirective(YamlVersion.V1_2));
    }

    @Test
    void rejectsDashOutsideIndent() {
        assertThrows(IllegalArgumentException.class, () -> new IndentLevels(2, 1));
    }
}
