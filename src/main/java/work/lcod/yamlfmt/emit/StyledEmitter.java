package work.lcod.yamlfmt.emit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.yamlfmt.model.AliasNode;
import work.lcod.yamlfmt.model.CollectionNode;
import work.lcod.yamlfmt.model.Comment;
import work.lcod.yamlfmt.model.Document;
import work.lcod.yamlfmt.model.MappingEntry;
import work.lcod.yamlfmt.model.MappingNode;
import work.lcod.yamlfmt.model.Node;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.ScalarType;
import work.lcod.yamlfmt.model.SequenceNode;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Writes a {@link Document} as YAML text. Layout is fixed (explicit {@code ---}, no
 * {@code ...}, block collections, compact sequence items); quoting, sequence indentation and
 * comment rewriting are delegated to a {@link StylePolicy}.
 */
public final class StyledEmitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(StyledEmitter.class);

    private final StylePolicy policy;
    private final int width;
    private final int mapIndent;

    public StyledEmitter(StylePolicy policy, int width, int mapIndent) {
        this.policy = Objects.requireNonNull(policy, "policy");
        if (mapIndent < 1) {
            throw new IllegalArgumentException("mapping indent must be positive: " + mapIndent);
        }
        this.width = width;
        this.mapIndent = mapIndent;
    }

    /**
     * Document text, without the preamble. Output ends with a line break.
     */
    public String emit(Document document) {
        LOGGER.debug("Emitting YAML {} document rooted at a {}", document.version(), document.root().kind());
        return new Run(document.version()).document(document);
    }

    private final class Run {
        private final StringBuilder out = new StringBuilder();
        private final YamlVersion version;
        private int column;

        Run(YamlVersion version) {
            this.version = version;
        }

        String document(Document document) {
            if (policy.writeVersionDirective(version)) {
                write("%YAML " + version);
                newline();
            }
            write("---");
            Node root = document.root();
            Comment pre = rewritePre(document.pre(), eventOf(root), 0);
            boolean bare = isBareNull(root);
            if (bare) {
                newline();
                writeLines(pre);
            } else if (isBlockCollection(root)) {
                String props = properties(root);
                if (!props.isEmpty()) {
                    write(" " + props);
                }
                newline();
                writeLines(pre);
                if (root instanceof MappingNode mapping) {
                    blockMapping(mapping, 0, 0, false);
                } else {
                    var levels = policy.sequenceIndent(new SequenceContext(true, 0));
                    blockSequence((SequenceNode) root, levels.dashOffset(), levels, 0, false);
                }
            } else {
                if (pre != null && !pre.isEmpty()) {
                    newline();
                    writeLines(pre);
                } else {
                    write(" ");
                }
                boolean block = inline(root, -1, mapIndent);
                endLine(block ? trailingLines(root.post()) : root.post(), EventKind.DOCUMENT_END, 0);
            }
            if (column > 0) {
                newline();
            }
            writeLines(rewritePre(document.end(), bare ? EventKind.STREAM_END : EventKind.DOCUMENT_END, 0));
            return out.toString();
        }

        private void blockMapping(MappingNode mapping, int indent, int depth, boolean inlineFirst) {
            List<MappingEntry> entries = mapping.entries();
            for (int i = 0; i < entries.size(); i++) {
                MappingEntry entry = entries.get(i);
                Node key = entry.key();
                Node value = entry.value();
                if (i > 0 || !inlineFirst) {
                    writeLines(rewritePre(key.pre(), eventOf(key), indent));
                    indentTo(indent);
                }
                writeKey(key);
                EventKind next = i == entries.size() - 1 ? EventKind.COLLECTION_END : EventKind.SCALAR;
                if (isBlockCollection(value)) {
                    String props = properties(value);
                    if (!props.isEmpty()) {
                        write(" " + props);
                    }
                    endLine(key.post(), EventKind.COLLECTION_START, indent);
                    if (value instanceof MappingNode nested) {
                        blockMapping(nested, indent + mapIndent, depth + 1, false);
                    } else {
                        var levels = policy.sequenceIndent(new SequenceContext(false, depth + 1));
                        blockSequence((SequenceNode) value, indent + levels.dashOffset(), levels, depth + 1, false);
                    }
                } else {
                    if (!isBareNull(value)) {
                        write(" ");
                    }
                    boolean block = inline(value, indent, indent + mapIndent);
                    endLine(block ? trailingLines(value.post()) : value.post(), next, indent);
                }
            }
        }

        private void blockSequence(SequenceNode sequence, int dash, IndentLevels levels, int depth, boolean inlineFirst) {
            int content = dash + levels.indent() - levels.dashOffset();
            List<Node> items = sequence.items();
            for (int i = 0; i < items.size(); i++) {
                Node item = items.get(i);
                boolean compact = isBlockCollection(item) && properties(item).isEmpty();
                if (i > 0 || !inlineFirst) {
                    Comment pre = compact ? merge(item.pre(), firstChild(item).pre()) : item.pre();
                    writeLines(rewritePre(pre, eventOf(item), dash));
                    indentTo(dash);
                }
                write("-");
                EventKind next = i == items.size() - 1 ? EventKind.COLLECTION_END : EventKind.SCALAR;
                if (isBlockCollection(item)) {
                    padTo(content);
                    if (!compact) {
                        write(properties(item));
                        newline();
                    }
                    if (item instanceof MappingNode mapping) {
                        blockMapping(mapping, content, depth + 1, compact);
                    } else {
                        var nested = policy.sequenceIndent(new SequenceContext(false, depth + 1));
                        blockSequence((SequenceNode) item, content, nested, depth + 1, compact);
                    }
                } else {
                    if (!isBareNull(item)) {
                        padTo(content);
                    }
                    boolean block = inline(item, dash, content);
                    endLine(block ? trailingLines(item.post()) : item.post(), next, dash);
                }
            }
        }

        private Node firstChild(Node collection) {
            if (collection instanceof MappingNode mapping) {
                return mapping.entries().get(0).key();
            }
            return ((SequenceNode) collection).get(0);
        }

        private void writeKey(Node key) {
            if (key instanceof AliasNode alias) {
                write("*" + alias.target() + " :");
                return;
            }
            if (key instanceof ScalarNode scalar) {
                scalar(scalar, ScalarStyles.Context.KEY, 0, 0);
            } else {
                write(flowText(key));
            }
            write(":");
        }

        /**
         * Writes a node that stays on the current line (scalars, aliases, flow and empty
         * collections). Block scalars continue on the following lines and carry their
         * end-of-line comment on the header; the return value tells whether one was written.
         */
        private boolean inline(Node node, int parentIndent, int contentIndent) {
            if (node instanceof AliasNode alias) {
                write("*" + alias.target());
                return false;
            }
            if (node instanceof ScalarNode scalar) {
                return scalar(scalar, ScalarStyles.Context.BLOCK, parentIndent, contentIndent);
            }
            String props = properties(node);
            if (!props.isEmpty()) {
                write(props + " ");
            }
            flow((CollectionNode) node, contentIndent);
            return false;
        }

        private boolean scalar(ScalarNode scalar, ScalarStyles.Context context, int parentIndent, int contentIndent) {
            ScalarStyle style = policy.chooseScalarStyle(scalar, ScalarStyles.candidate(scalar, context, version));
            String props = properties(scalar);
            String text = scalar.text();
            if (style == ScalarStyle.PLAIN && text.isEmpty()) {
                if (context != ScalarStyles.Context.BLOCK) {
                    write(props.isEmpty() ? "null" : props + " null");
                } else {
                    write(props);
                }
                return false;
            }
            if (!props.isEmpty()) {
                write(props + " ");
            }
            switch (style) {
                case LITERAL, FOLDED -> blockScalar(scalar, style, parentIndent, contentIndent);
                case SINGLE_QUOTED -> folded(ScalarStyles.singleQuoted(text), context, contentIndent);
                case DOUBLE_QUOTED -> folded(ScalarStyles.doubleQuoted(text), context, contentIndent);
                default -> folded(text, context, contentIndent);
            }
            return style.isBlock();
        }

        /**
         * Writes a single-line rendering, breaking at single spaces once the line runs past the
         * width. Keys and flow content never break.
         */
        private void folded(String rendered, ScalarStyles.Context context, int continuation) {
            if (context != ScalarStyles.Context.BLOCK || width <= 0) {
                write(rendered);
                return;
            }
            int start = 0;
            for (int i = 2; i < rendered.length() - 2; i++) {
                if (rendered.charAt(i) != ' ' || rendered.charAt(i - 1) == ' ' || rendered.charAt(i + 1) == ' '
                    || "-?:#".indexOf(rendered.charAt(i + 1)) >= 0) {
                    continue;
                }
                String word = rendered.substring(start, i);
                write(word);
                if (column > width) {
                    newline();
                    padTo(continuation);
                } else {
                    write(" ");
                }
                start = i + 1;
            }
            write(rendered.substring(start));
        }

        private void blockScalar(ScalarNode scalar, ScalarStyle style, int parentIndent, int contentIndent) {
            String text = scalar.text();
            String body = ScalarStyles.stripTrailingNewlines(text);
            int trailing = text.length() - body.length();
            List<String> lines;
            if (style == ScalarStyle.FOLDED && scalar.foldedLines() != null) {
                lines = scalar.foldedLines();
            } else {
                lines = Arrays.asList(body.split("\n", -1));
                if (style == ScalarStyle.FOLDED) {
                    if (lines.stream().anyMatch(line -> line.startsWith(" ") || line.startsWith("\t"))) {
                        style = ScalarStyle.LITERAL;
                    } else {
                        lines = foldLines(lines);
                    }
                }
            }
            String chomping = trailing == 0 ? "-" : trailing == 1 ? "" : "+";
            write((style == ScalarStyle.LITERAL ? "|" : ">") + indentationIndicator(lines, parentIndent, contentIndent) + chomping);
            String headerComment = endOfLine(scalar.post());
            if (!headerComment.isEmpty()) {
                write(" " + headerComment);
            }
            newline();
            for (String line : lines) {
                if (!line.isEmpty()) {
                    padTo(contentIndent);
                    write(line);
                }
                newline();
            }
            for (int i = 1; i < trailing; i++) {
                newline();
            }
        }

        private String indentationIndicator(List<String> lines, int parentIndent, int contentIndent) {
            for (String line : lines) {
                if (!line.isEmpty()) {
                    return line.startsWith(" ") ? String.valueOf(contentIndent - parentIndent) : "";
                }
            }
            return "";
        }

        /**
         * Source lines of a folded scalar for a value: one line break in the value becomes an
         * empty line between two text lines.
         */
        private List<String> foldLines(List<String> valueLines) {
            var lines = new ArrayList<String>();
            for (int i = 0; i < valueLines.size(); i++) {
                if (i > 0) {
                    lines.add("");
                }
                if (!valueLines.get(i).isEmpty()) {
                    lines.add(valueLines.get(i));
                }
            }
            return lines;
        }

        /**
         * Flow collection on the current line; long collections wrap between items.
         */
        private void flow(CollectionNode collection, int continuation) {
            boolean mapping = collection instanceof MappingNode;
            write(mapping ? "{" : "[");
            if (collection.isEmpty()) {
                write(mapping ? "}" : "]");
                return;
            }
            List<String> items = flowItems(collection);
            for (int i = 0; i < items.size(); i++) {
                String item = items.get(i);
                if (i > 0) {
                    write(",");
                }
                boolean spaced = mapping || i > 0;
                int length = item.codePointCount(0, item.length()) + (spaced ? 1 : 0);
                if (column + length > width && column > continuation) {
                    newline();
                    padTo(continuation);
                } else if (spaced) {
                    write(" ");
                }
                write(item);
            }
            if (mapping) {
                write(column > continuation ? " }" : "}");
            } else {
                write("]");
            }
        }

        private List<String> flowItems(CollectionNode collection) {
            var items = new ArrayList<String>();
            if (collection instanceof MappingNode mapping) {
                for (var entry : mapping.entries()) {
                    items.add(flowKey(entry.key()) + ": " + flowText(entry.value()));
                }
            } else {
                for (var item : ((SequenceNode) collection).items()) {
                    items.add(flowText(item));
                }
            }
            return items;
        }

        private String flowKey(Node key) {
            if (key instanceof AliasNode alias) {
                return "*" + alias.target() + " ";
            }
            return flowText(key);
        }

        private String flowText(Node node) {
            String props = properties(node);
            String prefix = props.isEmpty() ? "" : props + " ";
            if (node instanceof AliasNode alias) {
                return "*" + alias.target();
            }
            if (node instanceof ScalarNode scalar) {
                ScalarStyle style = policy.chooseScalarStyle(scalar, ScalarStyles.candidate(scalar, ScalarStyles.Context.FLOW, version));
                String text = scalar.text();
                return prefix + switch (style) {
                    case SINGLE_QUOTED -> ScalarStyles.singleQuoted(text);
                    case DOUBLE_QUOTED, LITERAL, FOLDED -> ScalarStyles.doubleQuoted(text);
                    default -> text.isEmpty() ? "null" : text;
                };
            }
            var collection = (CollectionNode) node;
            boolean mapping = collection instanceof MappingNode;
            if (collection.isEmpty()) {
                return prefix + (mapping ? "{}" : "[]");
            }
            String joined = String.join(", ", flowItems(collection));
            return prefix + (mapping ? "{ " + joined + " }" : "[" + joined + "]");
        }

        private void endLine(Comment post, EventKind next, int indent) {
            Comment comment = post == null ? null : policy.rewriteComment(post, new CommentContext(next, false, indent, column));
            if (comment == null || comment.isEmpty()) {
                if (column > 0) {
                    newline();
                }
                return;
            }
            String value = comment.value();
            int lineEnd = value.indexOf('\n');
            String endOfLine = lineEnd < 0 ? value : value.substring(0, lineEnd);
            String rest = lineEnd < 0 ? "" : value.substring(lineEnd + 1);
            if (!endOfLine.isEmpty()) {
                if (column > 0) {
                    padTo(Math.max(comment.column(), column + 1));
                } else {
                    padTo(indent);
                }
                write(endOfLine);
            }
            if (column > 0) {
                newline();
            }
            writeLines(Comment.of(rest));
        }

        private String endOfLine(Comment post) {
            if (post == null) {
                return "";
            }
            int lineEnd = post.value().indexOf('\n');
            return lineEnd < 0 ? post.value() : post.value().substring(0, lineEnd);
        }

        /**
         * Post comment without its end-of-line part, which a block scalar writes on its header.
         */
        private Comment trailingLines(Comment post) {
            if (post == null) {
                return null;
            }
            int lineEnd = post.value().indexOf('\n');
            return lineEnd < 0 ? null : new Comment(post.value().substring(lineEnd), post.column());
        }

        private Comment rewritePre(Comment pre, EventKind next, int indent) {
            if (pre == null || pre.isEmpty()) {
                return null;
            }
            return policy.rewriteComment(pre, new CommentContext(next, true, indent, column));
        }

        private void writeLines(Comment comment) {
            if (comment == null || comment.isEmpty()) {
                return;
            }
            if (column > 0) {
                newline();
            }
            String value = comment.value();
            String[] lines = value.split("\n", -1);
            int count = value.endsWith("\n") ? lines.length - 1 : lines.length;
            for (int i = 0; i < count; i++) {
                write(lines[i]);
                newline();
            }
        }

        private Comment merge(Comment first, Comment second) {
            if (first == null || first.isEmpty()) {
                return second;
            }
            if (second == null || second.isEmpty()) {
                return first;
            }
            String head = first.value().endsWith("\n") ? first.value() : first.value() + "\n";
            return new Comment(head + second.value(), first.column());
        }

        private String properties(Node node) {
            var props = new StringBuilder();
            if (node.anchor() != null) {
                props.append('&').append(node.anchor());
            }
            if (node.tag() != null) {
                if (props.length() > 0) {
                    props.append(' ');
                }
                props.append(ScalarStyles.tag(node.tag()));
            }
            return props.toString();
        }

        private void write(String text) {
            out.append(text);
            int lineBreak = text.lastIndexOf('\n');
            if (lineBreak < 0) {
                column += text.codePointCount(0, text.length());
            } else {
                column = text.codePointCount(lineBreak + 1, text.length());
            }
        }

        private void newline() {
            out.append('\n');
            column = 0;
        }

        private void indentTo(int target) {
            if (column > target) {
                newline();
            }
            padTo(target);
        }

        private void padTo(int target) {
            if (target > column) {
                out.append(" ".repeat(target - column));
                column = target;
            }
        }
    }

    private static boolean isBlockCollection(Node node) {
        return node instanceof CollectionNode collection && !collection.isFlow() && !collection.isEmpty();
    }

    private static boolean isBareNull(Node node) {
        return node instanceof ScalarNode scalar && scalar.type() == ScalarType.NULL && scalar.text().isEmpty()
            && scalar.anchor() == null && scalar.tag() == null;
    }

    private static EventKind eventOf(Node node) {
        return node instanceof CollectionNode ? EventKind.COLLECTION_START : EventKind.SCALAR;
    }
}
