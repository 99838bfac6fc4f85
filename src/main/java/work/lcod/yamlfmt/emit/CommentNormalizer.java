package work.lcod.yamlfmt.emit;

import java.util.regex.Pattern;
import work.lcod.yamlfmt.model.Comment;

/**
 * Rewrites comments before they are written: drops blank pre comments, collapses blank-line
 * runs, clamps end-of-line comments to one space after the content and re-indents full-line
 * comments to the structural indentation.
 *
 * <p>Comments are not given any lookahead. A column-0 comment that follows a blank line at the
 * end of a collection is assumed to introduce whatever comes next and keeps column 0; this is a
 * guess based on blank-line adjacency and is known to misplace some comments.
 */
public final class CommentNormalizer {
    private static final Pattern BLANK_RUN = Pattern.compile("\n{3,}");
    private static final Pattern FULL_LINE = Pattern.compile("^( *)#");

    public Comment normalize(Comment comment, CommentContext context) {
        if (comment == null || comment.isEmpty()) {
            return comment;
        }
        String value = comment.value();
        int column = comment.column();
        if (context.pre()) {
            if (value.isBlank() && !context.event().isBoundary()) {
                return comment.withValue("");
            }
            value = BLANK_RUN.matcher(value).replaceAll("\n");
        } else {
            value = BLANK_RUN.matcher(value).replaceAll("\n\n");
            if (column > context.cursorColumn() + 1) {
                column = context.cursorColumn() + 1;
            }
        }
        return new Comment(reindent(value, context), column);
    }

    private static String reindent(String value, CommentContext context) {
        String[] lines = value.split("\n", -1);
        String prefix = " ".repeat(Math.max(context.indent(), 0));
        int first = context.pre() ? 0 : 1;
        for (int i = first; i < lines.length; i++) {
            var matcher = FULL_LINE.matcher(lines[i]);
            if (!matcher.find()) {
                if (lines[i].isBlank()) {
                    lines[i] = "";
                }
                continue;
            }
            boolean afterBlank = i > 0 && lines[i - 1].isEmpty();
            if (afterBlank && matcher.group(1).isEmpty() && context.event() == EventKind.COLLECTION_END) {
                continue;
            }
            lines[i] = prefix + lines[i].substring(matcher.end() - 1);
        }
        return String.join("\n", lines);
    }
}
