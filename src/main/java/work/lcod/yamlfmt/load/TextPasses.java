package work.lcod.yamlfmt.load;

import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Text-level passes run around the structural load and dump.
 */
public final class TextPasses {
    private static final Pattern WHITESPACE_ONLY_LINES = Pattern.compile("^ +$", Pattern.MULTILINE);
    private static final Pattern DOCUMENT_START = Pattern.compile("^---(?:[ \\t]|$)", Pattern.MULTILINE);
    private static final Pattern VERSION_LINE = Pattern.compile("^%YAML[^\\n]*", Pattern.MULTILINE);
    private static final Pattern VERSION_DIRECTIVE = Pattern.compile("^%YAML[ \\t]+(\\d+)\\.(\\d+)", Pattern.MULTILINE);

    private TextPasses() {}

    /**
     * Turns whitespace-only lines into empty lines and CRLF line ends into LF; the parser only
     * keeps fully empty blank lines apart from the surrounding content.
     */
    public static String normalizeBlankLines(String text) {
        String unix = text.replace("\r\n", "\n");
        return WHITESPACE_ONLY_LINES.matcher(unix).replaceAll("");
    }

    public static boolean hasDocumentStart(String text) {
        return DOCUMENT_START.matcher(text).find();
    }

    /**
     * Comment lines before the first {@code ---} marker, with the blank lines that follow them.
     * Directive lines and blank lines before the first comment are not part of the preamble.
     */
    public static Optional<String> capturePreamble(String text) {
        if (!hasDocumentStart(text)) {
            return Optional.empty();
        }
        var preamble = new StringBuilder();
        int start = 0;
        while (start < text.length()) {
            int newline = text.indexOf('\n', start);
            int end = newline < 0 ? text.length() : newline + 1;
            String line = text.substring(start, end);
            start = end;
            if (line.startsWith("---")) {
                break;
            }
            if (line.stripLeading().startsWith("#")) {
                preamble.append(line);
            } else if (line.isBlank() && preamble.length() > 0) {
                preamble.append(line);
            }
        }
        return preamble.length() == 0 ? Optional.empty() : Optional.of(preamble.toString());
    }

    /**
     * Version declared by a {@code %YAML} directive ahead of the first document start marker.
     */
    public static Optional<YamlVersion> findVersionDirective(String text) {
        var start = DOCUMENT_START.matcher(text);
        String head = start.find() ? text.substring(0, start.start()) : "";
        var directive = VERSION_DIRECTIVE.matcher(head);
        if (!directive.find()) {
            return Optional.empty();
        }
        return Optional.of(new YamlVersion(Integer.parseInt(directive.group(1)), Integer.parseInt(directive.group(2))));
    }

    /**
     * Blanks out {@code %YAML} directive lines ahead of the first document start marker, keeping
     * line numbers intact. The version is handled by the caller; the parser only knows 1.0/1.1.
     */
    public static String maskVersionDirectives(String text) {
        var start = DOCUMENT_START.matcher(text);
        if (!start.find()) {
            return text;
        }
        String head = text.substring(0, start.start());
        return VERSION_LINE.matcher(head).replaceAll("") + text.substring(start.start());
    }

    /**
     * Ensures the text ends with exactly one newline.
     */
    public static String normalizeTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(0, end) + "\n";
    }
}
