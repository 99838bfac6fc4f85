package work.lcod.yamlfmt.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.yamlfmt.load.YamlParseException;
import work.lcod.yamlfmt.model.MappingNode;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarType;
import work.lcod.yamlfmt.model.YamlVersion;
import work.lcod.yamlfmt.support.YamlTestSupport;

class FormattedYamlTest {
    private final FormattedYaml yaml = new FormattedYaml();

    @Test
    void reformatsPlaybookIntoHouseStyle() throws Exception {
        String input = YamlTestSupport.fixture("playbook.input.yml");
        String expected = YamlTestSupport.fixture("playbook.expected.yml");

        String formatted = yaml.reformat(input);

        assertEquals(expected, formatted);
        assertEquals(YamlTestSupport.semantics(input), YamlTestSupport.semantics(formatted));
    }

    @Test
    void normalizesCommentPlacement() throws Exception {
        String input = YamlTestSupport.fixture("comments.input.yml");
        String expected = YamlTestSupport.fixture("comments.expected.yml");

        String formatted = yaml.reformat(input);

        assertEquals(expected, formatted);
        assertEquals(YamlTestSupport.semantics(input), YamlTestSupport.semantics(formatted));
    }

    @Test
    void formattingIsIdempotent() throws Exception {
        var inputs = List.of(
            YamlTestSupport.fixture("playbook.input.yml"),
            YamlTestSupport.fixture("comments.input.yml"),
            "a: 1\n\n\n\nb:\n  - x\n  -   y\n",
            "- - a\n  - b\n- {k: v}\n"
        );
        for (String input : inputs) {
            String once = yaml.reformat(input);
            assertEquals(once, yaml.reformat(once), () -> "second pass changed:\n" + once);
        }
    }

    @Test
    void addsDocumentStartMarker() {
        assertEquals("---\nkey: value\n", yaml.reformat("key: value\n"));
    }

    @Test
    void emptyInputDumpsBareMarker() {
        assertEquals("---\n", yaml.reformat(""));
    }

    @Test
    void commentOnlyInputKeepsComment() {
        assertEquals("---\n# just a comment\n", yaml.reformat("# just a comment\n"));
    }

    @Test
    void keepsPreambleVerbatim() {
        String input = "# one\n# two\n\n---\nkey: value\n";

        var document = yaml.load(input);

        assertEquals("# one\n# two\n\n", document.preamble().orElseThrow());
        assertEquals(input, yaml.dump(document));
    }

    @Test
    void endsWithSingleNewline() {
        assertEquals("---\nkey: value\n", yaml.reformat("key: value\n\n\n\n\n"));
        assertEquals("---\nkey: value\n", yaml.reformat("key: value"));
    }

    @Test
    void collapsesBlankLineRuns() {
        assertEquals("---\na: 1\n\nb: 2\n", yaml.reformat("a: 1\n\n\n\n\nb: 2\n"));
        assertEquals("---\na: 1\n\nb: 2\n", yaml.reformat("a: 1\n   \n\n\n   \nb: 2\n"));
        assertEquals("---\na:\n\n  # c\n  b: 1\n", yaml.reformat("a:\n\n\n\n\n  # c\n  b: 1\n"));
    }

    @Test
    void tightensEndOfLineComments() {
        String input = "# top\nkey: value  # eol\n# between\nother: 2\n";

        assertEquals("---\n# top\nkey: value # eol\n# between\nother: 2\n", yaml.reformat(input));
    }

    @Test
    void keepsCommentAfterDocumentStart() {
        String formatted = yaml.reformat("--- # playbook header\n- hosts: all\n");

        assertEquals("---\n# playbook header\n- hosts: all\n", formatted);
        assertEquals(formatted, yaml.reformat(formatted));
    }

    @Test
    void keepsCommentOnBlockScalarHeader() {
        String formatted = yaml.reformat("a: | # keep me\n  x\nb: 1\n");

        assertEquals("---\na: | # keep me\n  x\nb: 1\n", formatted);
        assertEquals(formatted, yaml.reformat(formatted));
    }

    @Test
    void movesCommentOnBareDashAboveItem() {
        String formatted = yaml.reformat("- # dash comment\n  name: x\n");

        assertEquals("---\n# dash comment\n- name: x\n", formatted);
        assertEquals(formatted, yaml.reformat(formatted));
    }

    @Test
    void movesCommentsOutOfFlowCollections() {
        String formatted = yaml.reformat("a: [\n  1, # one\n  2\n]\n");

        assertEquals("---\n# one\na: [1, 2]\n", formatted);
        assertEquals(formatted, yaml.reformat(formatted));
    }

    @Test
    void ignoresHashInsideQuotedFlowItems() {
        assertEquals("---\na: [\"x #y\", 2]\n", yaml.reformat("a: [\n  'x #y',\n  2\n]\n"));
    }

    @Test
    void rootSequenceIsFlush() {
        assertEquals("---\n- a\n- b\n", yaml.reformat("  - a\n  - b\n"));
        assertEquals("---\n- - a\n  - b\n", yaml.reformat("- - a\n  - b\n"));
    }

    @Test
    void indentsNestedSequences() {
        assertEquals("---\nlist:\n  - a\n  - b\n", yaml.reformat("list:\n- a\n- b\n"));
        assertEquals(
            "---\n- name: x\n  items:\n    - a\n    - b\n",
            yaml.reformat("- name: x\n  items:\n  - a\n  - b\n")
        );
    }

    @Test
    void keepsNestedSequencesFlushWhenDisabled() {
        var flush = new FormattedYaml(FormatterOptions.builder().indentSequences(false).build());

        assertEquals("---\nitems:\n- a\n", flush.reformat("items:\n    - a\n"));
    }

    @Test
    void recomputesQuotesFromContent() {
        String input = "a: 'it''s: here'\nb: 'say \"hi\": now'\nc: \"plain\"\nd: 'single'\ne: 'yes'\nf: \"123\"\n";

        assertEquals(
            "---\na: \"it's: here\"\nb: 'say \"hi\": now'\nc: plain\nd: single\ne: \"yes\"\nf: \"123\"\n",
            yaml.reformat(input)
        );
    }

    @Test
    void honorsSingleQuotePreference() {
        var single = new FormattedYaml(FormatterOptions.builder().preferredQuote("'").build());

        assertEquals("---\na: 'x: y'\nb: 'it''s: ok'\nc: z\n", single.reformat("a: \"x: y\"\nb: 'it''s: ok'\nc: \"z\"\n"));
    }

    @Test
    void ignoresUnsupportedQuotePreference() {
        var options = FormatterOptions.builder().preferredQuote("`").build();

        assertEquals(QuoteStyle.DOUBLE, options.preferredQuote());
    }

    @Test
    void keepsLegacyOctalLiterals() {
        assertEquals("---\nmode: 0_17\n", yaml.reformat("mode: 0_17\n"));
        assertEquals("---\nmode: 007\n", yaml.reformat("mode: 007\n"));

        var document = yaml.load("mode: 0644\n");
        var mode = (ScalarNode) ((MappingNode) document.root()).get("mode");

        assertEquals(BigInteger.valueOf(420), mode.toJava());
    }

    @Test
    void rewritesLegacyOctalInPlace() {
        String formatted = yaml.reformat("mode: 0_17\n", document -> {
            var mode = (ScalarNode) ((MappingNode) document.root()).get("mode");
            mode.setValue(8);
        });

        assertEquals("---\nmode: 0_10\n", formatted);
    }

    @Test
    void readsDeclaredVersion() {
        var document = yaml.load("%YAML 1.2\n---\nmode: 017\nflag: yes\n");
        var root = (MappingNode) document.root();
        var mode = (ScalarNode) root.get("mode");

        assertEquals(YamlVersion.V1_2, document.version());
        assertEquals(BigInteger.valueOf(17), mode.toJava());
        assertNull(mode.legacyOctal());
        assertEquals(ScalarType.STR, ((ScalarNode) root.get("flag")).type());
        assertEquals("%YAML 1.2\n---\nmode: 017\nflag: yes\n", yaml.dump(document));
    }

    @Test
    void dropsImpliedVersionDirective() {
        assertEquals("---\na: 1\n", yaml.reformat("%YAML 1.1\n---\na: 1\n"));
    }

    @Test
    void keepsBlockScalarChomping() {
        String input = "a: |+\n  x\n\nb: |-\n  y\nc: >\n  folded\n  text\n";

        assertEquals("---\n" + input, yaml.reformat(input));
    }

    @Test
    void keepsTagsAndAnchors() {
        String input = "base: &b\n  x: 1\nuse: *b\nsecret: !vault |\n  $ANSIBLE_VAULT;1.1\n  6162\nforced: !!str 123\n";

        assertEquals("---\n" + input, yaml.reformat(input));
    }

    @Test
    void spacesFlowCollections() {
        String input = "a: {b: 1, c: 2}\nd: {}\ne: [1,2]\nf: []\n";

        assertEquals("---\na: { b: 1, c: 2 }\nd: {}\ne: [1, 2]\nf: []\n", yaml.reformat(input));
    }

    @Test
    void wrapsLongPlainScalars() {
        String words = "lorem ipsum dolor sit amet ".repeat(8).trim();
        String formatted = yaml.reformat("text: " + words + "\n");

        assertTrue(formatted.contains("\n  "), formatted);
        var reloaded = (MappingNode) yaml.load(formatted).root();
        assertEquals(words, reloaded.get("text").toJava());
        assertEquals(formatted, yaml.reformat(formatted));
    }

    @Test
    void quotesValuesSetByTransforms() {
        String formatted = yaml.reformat("name: old\n",
            document -> ((MappingNode) document.root()).put("name", "value with: colon"));

        assertEquals("---\nname: \"value with: colon\"\n", formatted);
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(YamlParseException.class, () -> yaml.load("a: [1, 2\n"));
    }

    @Test
    void rejectsSeveralDocuments() {
        var ex = assertThrows(YamlParseException.class, () -> yaml.load("a: 1\n---\nb: 2\n"));

        assertEquals(2, ex.line());
    }

    @Test
    void rejectsInvalidTaggedLiteral() {
        var ex = assertThrows(YamlParseException.class, () -> yaml.load("a: !!int abc\n"));

        assertEquals(1, ex.line());
        assertEquals(4, ex.column());
    }
}
