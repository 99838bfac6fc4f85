package work.lcod.yamlfmt.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.yamlfmt.model.Comment;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * House style: preferred quote character, a flush root sequence, indented nested sequences
 * (unless disabled) and normalized comments. YAML 1.1 is implied and never declared.
 */
public final class FormattedStylePolicy implements StylePolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormattedStylePolicy.class);

    private final char preferredQuote;
    private final boolean indentSequences;
    private final CommentNormalizer comments = new CommentNormalizer();

    /**
     * @param preferredQuote {@code "} or {@code '}; any other character falls back to {@code "}
     */
    public FormattedStylePolicy(char preferredQuote, boolean indentSequences) {
        if (preferredQuote != '"' && preferredQuote != '\'') {
            LOGGER.debug("Ignoring unsupported preferred quote {}", preferredQuote);
            preferredQuote = '"';
        }
        this.preferredQuote = preferredQuote;
        this.indentSequences = indentSequences;
    }

    @Override
    public ScalarStyle chooseScalarStyle(ScalarNode scalar, ScalarStyle candidate) {
        if (candidate != ScalarStyle.SINGLE_QUOTED || preferredQuote == '\'') {
            return candidate;
        }
        return scalar.text().indexOf(preferredQuote) >= 0 ? ScalarStyle.SINGLE_QUOTED : ScalarStyle.DOUBLE_QUOTED;
    }

    @Override
    public IndentLevels sequenceIndent(SequenceContext context) {
        if (context.root() || !indentSequences) {
            return IndentLevels.FLUSH;
        }
        return IndentLevels.INDENTED;
    }

    @Override
    public Comment rewriteComment(Comment comment, CommentContext context) {
        return comments.normalize(comment, context);
    }

    @Override
    public boolean writeVersionDirective(YamlVersion version) {
        return !version.isLegacy();
    }
}
