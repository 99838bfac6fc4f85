package work.lcod.yamlfmt.emit;

import work.lcod.yamlfmt.model.Comment;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Formatting decisions the {@link StyledEmitter} delegates. Implementations must be pure
 * functions of their arguments.
 */
public interface StylePolicy {
    /**
     * Final style for a scalar, given the style the emitter's own analysis settled on. Only
     * quote styles may be exchanged; a plain or block candidate must be returned unchanged.
     */
    ScalarStyle chooseScalarStyle(ScalarNode scalar, ScalarStyle candidate);

    IndentLevels sequenceIndent(SequenceContext context);

    /**
     * Rewrites a comment right before it is written. An empty result drops the comment.
     */
    Comment rewriteComment(Comment comment, CommentContext context);

    boolean writeVersionDirective(YamlVersion version);
}
