package work.lcod.yamlfmt.emit;

import work.lcod.yamlfmt.model.ScalarNode;
import work.lcod.yamlfmt.model.ScalarResolver;
import work.lcod.yamlfmt.model.ScalarStyle;
import work.lcod.yamlfmt.model.ScalarType;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Scalar analysis and quoting helpers used by the emitter.
 */
final class ScalarStyles {
    private static final String CORE_TAG_PREFIX = "tag:yaml.org,2002:";
    private static final String LEADING_INDICATORS = "#,[]{}&*!|>'\"%@`";
    private static final String FLOW_INDICATORS = ",[]{}";

    enum Context {
        BLOCK,
        KEY,
        FLOW
    }

    private ScalarStyles() {}

    /**
     * Style picked from the content alone: block styles survive in block context, plain is used
     * when the text reads back as the same type, anything else is quoted. Source quotes are not
     * kept.
     */
    static ScalarStyle candidate(ScalarNode node, Context context, YamlVersion version) {
        String text = node.text();
        boolean printable = isPrintable(text);
        if (node.style().isBlock() && context == Context.BLOCK && printable && fitsBlock(text)) {
            return node.style();
        }
        if (node.type() == ScalarType.NULL && text.isEmpty() && node.tag() == null) {
            return ScalarStyle.PLAIN;
        }
        if (plainAllowed(text, context)
            && (node.tag() != null || ScalarResolver.resolve(text, version) == node.type())) {
            return ScalarStyle.PLAIN;
        }
        if (!printable || text.indexOf('\n') >= 0) {
            return ScalarStyle.DOUBLE_QUOTED;
        }
        return ScalarStyle.SINGLE_QUOTED;
    }

    static boolean plainAllowed(String text, Context context) {
        if (text.isEmpty() || text.indexOf('\n') >= 0 || !isPrintable(text)) {
            return false;
        }
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        if (first == ' ' || first == '\t' || last == ' ' || last == '\t') {
            return false;
        }
        if (LEADING_INDICATORS.indexOf(first) >= 0) {
            return false;
        }
        if ("-?:".indexOf(first) >= 0 && (text.length() == 1 || text.charAt(1) == ' ' || text.charAt(1) == '\t')) {
            return false;
        }
        if (text.startsWith("---") || text.startsWith("...")) {
            return false;
        }
        if (text.contains(": ") || text.contains(":\t") || text.contains(" #") || text.contains("\t#") || last == ':') {
            return false;
        }
        if (context != Context.BLOCK) {
            for (int i = 0; i < text.length(); i++) {
                if (FLOW_INDICATORS.indexOf(text.charAt(i)) >= 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Whether the text can be written as a block scalar without changing its value.
     */
    static boolean fitsBlock(String text) {
        String body = stripTrailingNewlines(text);
        if (body.isEmpty()) {
            return false;
        }
        for (String line : body.split("\n", -1)) {
            if (!line.isEmpty() && line.isBlank()) {
                return false;
            }
        }
        return true;
    }

    static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end);
    }

    static boolean isPrintable(String text) {
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (!isPrintable(cp)) {
                return false;
            }
            i += Character.charCount(cp);
        }
        return true;
    }

    private static boolean isPrintable(int cp) {
        return cp == '\t' || cp == '\n'
            || (cp >= 0x20 && cp <= 0x7E)
            || cp == 0x85
            || (cp >= 0xA0 && cp <= 0xD7FF)
            || (cp >= 0xE000 && cp <= 0xFFFD && cp != 0xFEFF)
            || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    static String singleQuoted(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    static String doubleQuoted(String text) {
        var out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case 0 -> out.append("\\0");
                case 0x07 -> out.append("\\a");
                case '\b' -> out.append("\\b");
                case '\t' -> out.append("\\t");
                case '\n' -> out.append("\\n");
                case 0x0B -> out.append("\\v");
                case '\f' -> out.append("\\f");
                case '\r' -> out.append("\\r");
                case 0x1B -> out.append("\\e");
                case 0x85 -> out.append("\\N");
                case 0x2028 -> out.append("\\L");
                case 0x2029 -> out.append("\\P");
                case 0xFEFF -> out.append("\\uFEFF");
                default -> {
                    if (isPrintable(cp)) {
                        out.appendCodePoint(cp);
                    } else if (cp <= 0xFF) {
                        out.append(String.format("\\x%02X", cp));
                    } else if (cp <= 0xFFFF) {
                        out.append(String.format("\\u%04X", cp));
                    } else {
                        out.append(String.format("\\U%08X", cp));
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /**
     * Short form of a tag: {@code !!str} for core tags, verbatim {@code !<...>} for other URIs.
     */
    static String tag(String tag) {
        if (tag.startsWith(CORE_TAG_PREFIX)) {
            return "!!" + tag.substring(CORE_TAG_PREFIX.length());
        }
        if (tag.startsWith("!")) {
            return tag;
        }
        return "!<" + tag + ">";
    }
}
