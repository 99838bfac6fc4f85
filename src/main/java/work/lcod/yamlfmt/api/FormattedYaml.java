package work.lcod.yamlfmt.api;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.yamlfmt.emit.FormattedStylePolicy;
import work.lcod.yamlfmt.emit.StyledEmitter;
import work.lcod.yamlfmt.load.DocumentComposer;
import work.lcod.yamlfmt.load.TextPasses;
import work.lcod.yamlfmt.model.Document;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Public entry point: loads YAML text into a {@link Document} and dumps it back in the house
 * style.
 *
 * <p>Documents default to YAML 1.1 unless the text declares another version with a
 * {@code %YAML} directive. Instances are immutable and may be shared; the documents they
 * produce are not thread-safe.
 */
public final class FormattedYaml {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormattedYaml.class);

    private final FormatterOptions options;
    private final StyledEmitter emitter;

    public FormattedYaml() {
        this(FormatterOptions.defaults());
    }

    public FormattedYaml(FormatterOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        var policy = new FormattedStylePolicy(options.preferredQuote().character(), options.indentSequences());
        this.emitter = new StyledEmitter(policy, options.width(), options.mapIndent());
    }

    public FormatterOptions options() {
        return options;
    }

    /**
     * @throws work.lcod.yamlfmt.load.YamlParseException when the text is not a single
     *     well-formed document or holds a literal that is invalid for its YAML version
     */
    public Document load(String text) {
        Objects.requireNonNull(text, "text");
        String normalized = TextPasses.normalizeBlankLines(text);
        var preamble = TextPasses.capturePreamble(normalized);
        var version = TextPasses.findVersionDirective(normalized).orElseGet(() -> {
            LOGGER.debug("No %YAML directive, pinning version {}", YamlVersion.V1_1);
            return YamlVersion.V1_1;
        });
        var document = new DocumentComposer(version).compose(normalized);
        preamble.ifPresent(lines -> {
            LOGGER.debug("Captured {} preamble line(s)", lines.lines().count());
            document.setPreamble(lines);
        });
        return document;
    }

    public String dump(Document document) {
        Objects.requireNonNull(document, "document");
        var out = new StringBuilder();
        document.preamble().ifPresent(out::append);
        out.append(emitter.emit(document));
        return TextPasses.normalizeTrailingNewlines(out.toString());
    }

    /**
     * Loads the text, applies the transforms in order and dumps the result.
     */
    public String reformat(String text, DocumentTransform... transforms) {
        var document = load(text);
        for (var transform : transforms) {
            transform.apply(document);
        }
        return dump(document);
    }
}
