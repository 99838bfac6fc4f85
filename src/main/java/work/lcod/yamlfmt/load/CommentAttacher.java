package work.lcod.yamlfmt.load;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.Mark;
import work.lcod.yamlfmt.model.Comment;
import work.lcod.yamlfmt.model.Document;
import work.lcod.yamlfmt.model.Node;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarStyle;

/**
 * Recovers comments and blank lines from the source text, using the marks of the composed nodes
 * to tell content lines from comment lines.
 *
 * <p>Blank and comment lines between two content lines form a run. A run that precedes the first
 * entry of a collection (or the root node) becomes that entry's pre comment; any other run trails
 * the node that ends the previous content line and joins its post comment, after the end-of-line
 * comment found on that line. Lines after the last content line belong to the document end.
 *
 * <p>Comments that share a line with structure only are moved next to the nearest node: a
 * comment after {@code ---} opens the document pre comment, a comment after a block scalar
 * header is that scalar's end-of-line comment, a comment on a line holding only sequence dashes
 * precedes the item below it, and comments inside a multi-line flow collection precede the entry
 * that holds the collection.
 */
final class CommentAttacher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommentAttacher.class);
    private static final Pattern BLOCK_HEADER = Pattern.compile("[|>]([-+0-9]*)[ \\t]*(#.*)?$");
    private static final Pattern DASH_ONLY = Pattern.compile("^[ \\t]*(?:-[ \\t]+)+(#.*)$");
    private static final Pattern START_COMMENT = Pattern.compile("^---[ \\t]+(#.*)$");

    private final String[] lines;
    private final BitSet content = new BitSet();
    private final Map<Integer, Leaf> leafEnds = new HashMap<>();
    private final Map<Integer, EntryStart> entryStarts = new HashMap<>();
    private final Map<Node, PostBuilder> posts = new LinkedHashMap<>();
    private final Map<Node, StringBuilder> pres = new LinkedHashMap<>();
    private final List<FlowSpan> flowSpans = new ArrayList<>();
    private final StringBuilder documentPre = new StringBuilder();
    private final StringBuilder documentEnd = new StringBuilder();
    private int documentStartLine = -1;

    CommentAttacher(String text) {
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        this.lines = text.isEmpty() ? new String[0] : body.split("\n", -1);
    }

    void documentStart(Mark mark) {
        documentStartLine = mark.getLine();
    }

    void markContent(Mark start, Mark end) {
        int last = Math.min(end.getLine(), lines.length - 1);
        if (last >= start.getLine()) {
            content.set(start.getLine(), last + 1);
        }
    }

    void entry(Node node, Mark start, boolean first, boolean root) {
        entryStarts.putIfAbsent(start.getLine(), new EntryStart(node, first, root));
    }

    void leaf(Node node, Mark end, boolean key) {
        leafEnds.put(end.getLine(), new Leaf(node, end.getLine(), end.getColumn(), key));
    }

    /**
     * Registers a literal or folded scalar. The scalar owns every line from its header to its
     * last content line; trailing blank lines belong to it only with keep chomping.
     */
    void blockScalar(ScalarNode node, Mark start, Mark end) {
        int headerLine = start.getLine();
        int endLine = end.getLine();
        // the scanner stops after the indentation of the line following the block
        if (endLine > headerLine && (endLine >= lines.length || leadingBlank(lines[endLine], end.getColumn()))) {
            endLine--;
        }
        endLine = Math.min(endLine, lines.length - 1);
        boolean keep = false;
        if (headerLine < lines.length) {
            String headerText = lines[headerLine];
            var header = BLOCK_HEADER.matcher(headerText);
            if (header.find()) {
                keep = header.group(1).contains("+");
                if (header.group(2) != null) {
                    posts.computeIfAbsent(node, key -> new PostBuilder())
                        .endOfLine(header.group(2).stripTrailing(), headerText.codePointCount(0, header.start(2)));
                }
            }
        }
        if (!keep) {
            while (endLine > headerLine && lines[endLine].isEmpty()) {
                endLine--;
            }
        }
        if (endLine >= headerLine) {
            content.set(headerLine, endLine + 1);
        }
        if (node.style() == ScalarStyle.FOLDED) {
            node.setFoldedLines(relativeLines(headerLine + 1, endLine));
        }
        int endColumn = endLine >= 0 && endLine < lines.length ? lines[endLine].codePointCount(0, lines[endLine].length()) : 0;
        leafEnds.put(endLine, new Leaf(node, endLine, endColumn, false));
    }

    /**
     * Registers a flow collection written over several lines; its inner comments are collected
     * when the document is attached.
     */
    void flowCollection(Node node, Mark start, Mark end) {
        if (end.getLine() > start.getLine()) {
            flowSpans.add(new FlowSpan(node, start.getLine(), start.getColumn(), end.getLine(), end.getColumn()));
        }
    }

    void attach(Document document) {
        for (var leaf : leafEnds.values()) {
            collectEndOfLineComment(leaf);
        }
        if (documentStartLine >= 0 && documentStartLine < lines.length) {
            var start = START_COMMENT.matcher(lines[documentStartLine]);
            if (start.find()) {
                documentPre.append(start.group(1).stripTrailing()).append('\n');
            }
        }
        var flowPres = new LinkedHashMap<EntryStart, List<String>>();
        for (var span : flowSpans) {
            List<String> comments = flowComments(span);
            if (comments.isEmpty()) {
                continue;
            }
            EntryStart entry = entryStarts.get(span.startLine());
            if (entry != null) {
                flowPres.computeIfAbsent(entry, key -> new ArrayList<>()).addAll(comments);
            } else {
                posts.computeIfAbsent(span.node(), key -> new PostBuilder()).trailing(comments);
            }
        }
        int first = documentStartLine >= 0 ? documentStartLine + 1 : 0;
        int previous = documentStartLine;
        int index = first;
        while (index < lines.length) {
            if (!isGap(index)) {
                if (!content.get(index)) {
                    collectDashLineComment(index);
                }
                previous = index;
                index++;
                continue;
            }
            int runEnd = index;
            while (runEnd < lines.length && isGap(runEnd)) {
                runEnd++;
            }
            var run = new ArrayList<String>();
            for (int i = index; i < runEnd; i++) {
                run.add(lines[i]);
            }
            assignRun(run, previous, runEnd < lines.length ? runEnd : -1);
            index = runEnd;
        }
        flowPres.forEach(this::appendPre);

        for (var entry : pres.entrySet()) {
            entry.getKey().setPre(new Comment(entry.getValue().toString(), firstCommentColumn(entry.getValue())));
        }
        for (var entry : posts.entrySet()) {
            entry.getKey().setPost(entry.getValue().build());
        }
        if (documentPre.length() > 0) {
            document.setPre(new Comment(documentPre.toString(), firstCommentColumn(documentPre)));
        }
        if (documentEnd.length() > 0) {
            document.setEnd(new Comment(documentEnd.toString(), firstCommentColumn(documentEnd)));
        }
    }

    private void assignRun(List<String> run, int previous, int next) {
        if (next < 0) {
            append(documentEnd, run);
            return;
        }
        EntryStart entry = entryStarts.get(next);
        if (entry != null && entry.first()) {
            appendPre(entry, run);
            return;
        }
        Leaf leaf = previous >= 0 ? leafEnds.get(previous) : null;
        if (leaf != null) {
            posts.computeIfAbsent(leaf.node(), key -> new PostBuilder()).trailing(run);
            return;
        }
        if (entry != null) {
            appendPre(entry, run);
            return;
        }
        if (previous <= documentStartLine) {
            append(documentPre, run);
            return;
        }
        LOGGER.debug("Dropping {} comment line(s) before line {}: no node to attach them to", run.size(), next + 1);
    }

    private void appendPre(EntryStart entry, List<String> run) {
        if (entry.root()) {
            append(documentPre, run);
        } else {
            append(pres.computeIfAbsent(entry.node(), key -> new StringBuilder()), run);
        }
    }

    private void collectDashLineComment(int index) {
        var dashes = DASH_ONLY.matcher(lines[index]);
        if (!dashes.find()) {
            return;
        }
        int next = index + 1;
        while (next < lines.length && isGap(next)) {
            next++;
        }
        EntryStart entry = entryStarts.get(next);
        if (entry == null) {
            LOGGER.debug("Dropping comment on line {}: no item starts below it", index + 1);
            return;
        }
        appendPre(entry, List.of(dashes.group(1).stripTrailing()));
    }

    /**
     * Comments inside a flow collection span, skipping {@code #} characters of quoted scalars.
     */
    private List<String> flowComments(FlowSpan span) {
        var found = new ArrayList<String>();
        char quote = 0;
        for (int line = span.startLine(); line <= span.endLine() && line < lines.length; line++) {
            String text = lines[line];
            int from = line == span.startLine() ? Math.min(span.startColumn(), text.length()) : 0;
            int to = line == span.endLine() ? Math.min(span.endColumn(), text.length()) : text.length();
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (quote == '"') {
                    if (ch == '\\') {
                        i++;
                    } else if (ch == '"') {
                        quote = 0;
                    }
                } else if (quote == '\'') {
                    if (ch == '\'' && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else if (ch == '\'') {
                        quote = 0;
                    }
                } else if ((ch == '"' || ch == '\'') && atTokenStart(text, i)) {
                    quote = ch;
                } else if (ch == '#' && (i == 0 || text.charAt(i - 1) == ' ' || text.charAt(i - 1) == '\t')) {
                    found.add(text.substring(i).stripTrailing());
                    break;
                }
            }
        }
        return found;
    }

    private static boolean atTokenStart(String text, int index) {
        int i = index - 1;
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i--;
        }
        return i < 0 || "[{,:?".indexOf(text.charAt(i)) >= 0;
    }

    private void collectEndOfLineComment(Leaf leaf) {
        if (leaf.line() < 0 || leaf.line() >= lines.length) {
            return;
        }
        String line = lines[leaf.line()];
        int columns = line.codePointCount(0, line.length());
        if (leaf.endColumn() >= columns) {
            return;
        }
        String rest = line.substring(line.offsetByCodePoints(0, leaf.endColumn())).stripLeading();
        if (leaf.key()) {
            if (!rest.startsWith(":")) {
                return;
            }
            rest = rest.substring(1).stripLeading();
        }
        if (!rest.startsWith("#")) {
            return;
        }
        int offset = line.length() - rest.length();
        int column = line.codePointCount(0, offset);
        posts.computeIfAbsent(leaf.node(), key -> new PostBuilder()).endOfLine(rest.stripTrailing(), column);
    }

    private boolean isGap(int index) {
        if (content.get(index)) {
            return false;
        }
        String line = lines[index];
        return line.isBlank() || line.stripLeading().startsWith("#");
    }

    private List<String> relativeLines(int from, int to) {
        var result = new ArrayList<String>();
        int indent = Integer.MAX_VALUE;
        for (int i = from; i <= to && i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                indent = Math.min(indent, lines[i].length() - lines[i].stripLeading().length());
            }
        }
        for (int i = from; i <= to && i < lines.length; i++) {
            result.add(lines[i].isEmpty() ? "" : lines[i].substring(Math.min(indent, lines[i].length())));
        }
        while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private static boolean leadingBlank(String line, int column) {
        int upTo = Math.min(column, line.length());
        return line.substring(0, upTo).isBlank();
    }

    private static void append(StringBuilder target, List<String> run) {
        for (String line : run) {
            target.append(line).append('\n');
        }
    }

    private static int firstCommentColumn(CharSequence text) {
        for (String line : text.toString().split("\n")) {
            int hash = line.indexOf('#');
            if (hash >= 0) {
                return hash;
            }
        }
        return 0;
    }

    private record Leaf(Node node, int line, int endColumn, boolean key) {}

    private record EntryStart(Node node, boolean first, boolean root) {}

    private record FlowSpan(Node node, int startLine, int startColumn, int endLine, int endColumn) {}

    private static final class PostBuilder {
        private String endOfLine = "";
        private int column;
        private final StringBuilder trailing = new StringBuilder();

        void endOfLine(String text, int column) {
            this.endOfLine = text;
            this.column = column;
        }

        void trailing(List<String> run) {
            append(trailing, run);
        }

        Comment build() {
            return new Comment(endOfLine + "\n" + trailing, column);
        }
    }
}
