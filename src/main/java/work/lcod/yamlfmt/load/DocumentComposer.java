package work.lcod.yamlfmt.load;

import java.io.StringReader;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;
import work.lcod.yamlfmt.model.AliasNode;
import work.lcod.yamlfmt.model.CollectionNode;
import work.lcod.yamlfmt.model.Document;
import work.lcod.yamlfmt.model.MappingNode;
import work.lcod.yamlfmt.model.Node;
import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarResolver;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.ScalarType;
import work.lcod.yamlfmt.model.SequenceNode;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Builds a {@link Document} from SnakeYAML parse events, resolving scalar types under a pinned
 * YAML version and handing node marks to the {@link CommentAttacher}.
 */
public final class DocumentComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentComposer.class);
    private static final String CORE_TAG_PREFIX = "tag:yaml.org,2002:";

    private final YamlVersion version;

    public DocumentComposer(YamlVersion version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    /**
     * @throws YamlParseException when the text is not a single well-formed YAML document
     */
    public Document compose(String text) {
        var attacher = new CommentAttacher(text);
        var yaml = new Yaml(new LoaderOptions());
        var events = new EventCursor(yaml.parse(new StringReader(TextPasses.maskVersionDirectives(text))).iterator());
        events.expect(StreamStartEvent.class);

        Node root;
        if (events.peek() instanceof StreamEndEvent) {
            LOGGER.debug("Empty stream, composing a null root");
            root = new ScalarNode("", ScalarType.NULL, ScalarStyle.PLAIN, null);
        } else {
            var start = events.expect(DocumentStartEvent.class);
            if (start.getExplicit()) {
                attacher.documentStart(start.getEndMark());
            }
            root = new Composition(events, attacher).node(events.next(), Placement.ROOT, false);
            events.expect(DocumentEndEvent.class);
        }
        if (!(events.peek() instanceof StreamEndEvent)) {
            Mark mark = events.peek().getStartMark();
            throw new YamlParseException("expected a single document in the stream", mark.getLine() + 1, mark.getColumn() + 1);
        }
        var document = new Document(root, version);
        attacher.attach(document);
        return document;
    }

    private enum Placement {
        ROOT,
        FIRST_KEY,
        KEY,
        VALUE,
        FIRST_ITEM,
        ITEM
    }

    private final class Composition {
        private final EventCursor events;
        private final CommentAttacher attacher;

        Composition(EventCursor events, CommentAttacher attacher) {
            this.events = events;
            this.attacher = attacher;
        }

        Node node(Event event, Placement placement, boolean inFlow) {
            if (event instanceof AliasEvent alias) {
                var node = new AliasNode(alias.getAnchor());
                leaf(node, alias, placement, inFlow);
                return node;
            }
            if (event instanceof ScalarEvent scalar) {
                var node = scalar(scalar);
                if (!inFlow) {
                    register(node, scalar.getStartMark(), placement);
                    if (node.style().isBlock()) {
                        attacher.blockScalar(node, scalar.getStartMark(), scalar.getEndMark());
                    } else {
                        attacher.markContent(scalar.getStartMark(), scalar.getEndMark());
                        attacher.leaf(node, scalar.getEndMark(), isKey(placement));
                    }
                }
                return node;
            }
            if (event instanceof SequenceStartEvent start) {
                var node = new SequenceNode();
                node.setFlow(start.isFlow());
                node.setAnchor(start.getAnchor());
                node.setTag(start.getTag());
                if (!inFlow) {
                    register(node, start.getStartMark(), placement);
                }
                boolean nestedFlow = inFlow || start.isFlow();
                boolean first = true;
                while (!(events.peek() instanceof SequenceEndEvent)) {
                    node.add(node(events.next(), first ? Placement.FIRST_ITEM : Placement.ITEM, nestedFlow));
                    first = false;
                }
                closeCollection(node, start, events.next(), placement, inFlow);
                return node;
            }
            if (event instanceof MappingStartEvent start) {
                var node = new MappingNode();
                node.setFlow(start.isFlow());
                node.setAnchor(start.getAnchor());
                node.setTag(start.getTag());
                if (!inFlow) {
                    register(node, start.getStartMark(), placement);
                }
                boolean nestedFlow = inFlow || start.isFlow();
                boolean first = true;
                while (!(events.peek() instanceof MappingEndEvent)) {
                    Node key = node(events.next(), first ? Placement.FIRST_KEY : Placement.KEY, nestedFlow);
                    Node value = node(events.next(), Placement.VALUE, nestedFlow);
                    node.add(key, value);
                    first = false;
                }
                closeCollection(node, start, events.next(), placement, inFlow);
                return node;
            }
            Mark mark = event.getStartMark();
            throw new YamlParseException("unexpected " + event.getClass().getSimpleName() + " while reading a node",
                mark.getLine() + 1, mark.getColumn() + 1);
        }

        private void closeCollection(Node node, Event start, Event end, Placement placement, boolean inFlow) {
            if (inFlow || !(node instanceof CollectionNode collection) || !collection.isFlow()) {
                return;
            }
            attacher.markContent(start.getStartMark(), end.getEndMark());
            attacher.flowCollection(node, start.getStartMark(), end.getEndMark());
            attacher.leaf(node, end.getEndMark(), isKey(placement));
        }

        private void leaf(Node node, Event event, Placement placement, boolean inFlow) {
            if (inFlow) {
                return;
            }
            register(node, event.getStartMark(), placement);
            attacher.markContent(event.getStartMark(), event.getEndMark());
            attacher.leaf(node, event.getEndMark(), isKey(placement));
        }

        private void register(Node node, Mark start, Placement placement) {
            switch (placement) {
                case ROOT -> attacher.entry(node, start, true, true);
                case FIRST_KEY, FIRST_ITEM -> attacher.entry(node, start, true, false);
                case KEY, ITEM -> attacher.entry(node, start, false, false);
                case VALUE -> {
                }
            }
        }

        private boolean isKey(Placement placement) {
            return placement == Placement.FIRST_KEY || placement == Placement.KEY;
        }
    }

    private ScalarNode scalar(ScalarEvent event) {
        String text = event.getValue();
        String tag = event.getTag();
        ScalarStyle style = style(event.getScalarStyle());
        ScalarType type;
        if (tag == null || tag.equals("!")) {
            type = style == ScalarStyle.PLAIN && tag == null ? ScalarResolver.resolve(text, version) : ScalarType.STR;
        } else {
            type = taggedType(tag);
        }
        Object value = typedValue(text, type, event.getStartMark());
        var node = new ScalarNode(text, type, style, value);
        node.setAnchor(event.getAnchor());
        node.setTag(tag);
        if (type == ScalarType.INT && style == ScalarStyle.PLAIN && tag == null) {
            LegacyOctalPreserver.classify(text, version).ifPresent(node::setLegacyOctal);
        }
        return node;
    }

    private Object typedValue(String text, ScalarType type, Mark mark) {
        try {
            return switch (type) {
                case NULL -> null;
                case BOOL -> ScalarResolver.parseBoolean(text);
                case INT -> ScalarResolver.parseInteger(text, version);
                case FLOAT -> ScalarResolver.parseFloat(text, version);
                case STR, OTHER -> text;
            };
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new YamlParseException("invalid " + type.name().toLowerCase(Locale.ROOT) + " literal '" + text
                + "' for YAML " + version, mark.getLine() + 1, mark.getColumn() + 1, ex);
        }
    }

    private static ScalarType taggedType(String tag) {
        if (!tag.startsWith(CORE_TAG_PREFIX)) {
            return ScalarType.OTHER;
        }
        return switch (tag.substring(CORE_TAG_PREFIX.length())) {
            case "null" -> ScalarType.NULL;
            case "bool" -> ScalarType.BOOL;
            case "int" -> ScalarType.INT;
            case "float" -> ScalarType.FLOAT;
            case "str" -> ScalarType.STR;
            default -> ScalarType.OTHER;
        };
    }

    private static ScalarStyle style(DumperOptions.ScalarStyle style) {
        return switch (style) {
            case SINGLE_QUOTED -> ScalarStyle.SINGLE_QUOTED;
            case DOUBLE_QUOTED -> ScalarStyle.DOUBLE_QUOTED;
            case LITERAL -> ScalarStyle.LITERAL;
            case FOLDED -> ScalarStyle.FOLDED;
            default -> ScalarStyle.PLAIN;
        };
    }

    /**
     * One-event lookahead over the parser, translating SnakeYAML failures.
     */
    private static final class EventCursor {
        private final Iterator<Event> delegate;
        private Event peeked;

        EventCursor(Iterator<Event> delegate) {
            this.delegate = delegate;
        }

        Event peek() {
            if (peeked == null) {
                peeked = pull();
            }
            return peeked;
        }

        Event next() {
            Event event = peek();
            peeked = null;
            return event;
        }

        <T extends Event> T expect(Class<T> type) {
            Event event = next();
            if (!type.isInstance(event)) {
                Mark mark = event.getStartMark();
                throw new YamlParseException("expected " + type.getSimpleName() + " but found " + event.getClass().getSimpleName(),
                    mark.getLine() + 1, mark.getColumn() + 1);
            }
            return type.cast(event);
        }

        private Event pull() {
            try {
                if (!delegate.hasNext()) {
                    throw new YamlParseException("unexpected end of the event stream", 0, 0);
                }
                return delegate.next();
            } catch (MarkedYAMLException ex) {
                Mark mark = ex.getProblemMark() != null ? ex.getProblemMark() : ex.getContextMark();
                throw new YamlParseException(ex.getMessage(), mark == null ? 0 : mark.getLine() + 1,
                    mark == null ? 0 : mark.getColumn() + 1, ex);
            } catch (YAMLException ex) {
                throw new YamlParseException(ex.getMessage(), 0, 0, ex);
            }
        }
    }
}
