package work.lcod.yamlfmt.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.yamlfmt.model.Comment;

class CommentNormalizerTest {
    private final CommentNormalizer normalizer = new CommentNormalizer();

    @Test
    void dropsBlankPreCommentInsideCollection() {
        var result = normalizer.normalize(Comment.of("\n\n"), new CommentContext(EventKind.SCALAR, true, 0, 0));

        assertEquals("", result.value());
    }

    @Test
    void keepsBlankPreCommentAtBoundary() {
        var result = normalizer.normalize(Comment.of("\n\n\n\n"), new CommentContext(EventKind.COLLECTION_END, true, 0, 0));

        assertEquals("\n", result.value());
    }

    @Test
    void collapsesBlankRuns() {
        var pre = normalizer.normalize(Comment.of("\n\n\n\n# c\n"), new CommentContext(EventKind.SCALAR, true, 0, 0));
        var post = normalizer.normalize(Comment.of("# eol\n\n\n\n\n"), new CommentContext(EventKind.SCALAR, false, 0, 4));

        assertEquals("\n# c\n", pre.value());
        assertEquals("# eol\n\n", post.value());
    }

    @Test
    void clampsEndOfLineColumn() {
        var far = normalizer.normalize(new Comment("# x\n", 30), new CommentContext(EventKind.SCALAR, false, 0, 10));
        var near = normalizer.normalize(new Comment("# x\n", 5), new CommentContext(EventKind.SCALAR, false, 0, 10));

        assertEquals(11, far.column());
        assertEquals(5, near.column());
    }

    @Test
    void reindentsFullLineComments() {
        var pre = normalizer.normalize(Comment.of("      # c\n"), new CommentContext(EventKind.SCALAR, true, 2, 0));
        var post = normalizer.normalize(Comment.of("\n# c\n"), new CommentContext(EventKind.SCALAR, false, 4, 6));

        assertEquals("  # c\n", pre.value());
        assertEquals("\n    # c\n", post.value());
    }

    @Test
    void keepsColumnZeroCommentAfterBlankLineAtCollectionEnd() {
        var context = new CommentContext(EventKind.COLLECTION_END, false, 4, 10);

        assertEquals("\n\n# next\n", normalizer.normalize(Comment.of("\n\n# next\n"), context).value());
        assertEquals("\n\n    # deep\n", normalizer.normalize(Comment.of("\n\n      # deep\n"), context).value());
    }

    @Test
    void reindentsColumnZeroCommentBeforeSibling() {
        var context = new CommentContext(EventKind.SCALAR, false, 4, 10);

        assertEquals("\n\n    # next\n", normalizer.normalize(Comment.of("\n\n# next\n"), context).value());
    }
}
