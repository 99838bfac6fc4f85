package work.lcod.yamlfmt.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.yamlfmt.api.FormatterOptions;

/**
 * Reads formatter settings from the {@code [yaml]} table of a TOML file:
 *
 * <pre>
 * [yaml]
 * preferred_quote = "'"
 * indent_sequences = false
 * width = 100
 * </pre>
 */
public final class FormatterOptionsLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormatterOptionsLoader.class);
    private static final String TABLE = "yaml";

    private FormatterOptionsLoader() {}

    /**
     * Options from {@code path}, or the defaults when the file does not exist.
     *
     * @throws IllegalStateException when the file is not valid TOML or holds values of the wrong type
     */
    public static FormatterOptions load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            LOGGER.debug("No formatter configuration at {}, using defaults", path);
            return FormatterOptions.defaults();
        }
        try {
            return fromToml(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + path, ex);
        }
    }

    public static FormatterOptions fromToml(String text, String source) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid formatter configuration " + source + ": " + errors);
        }
        TomlTable table = result.getTable(TABLE);
        var builder = FormatterOptions.builder();
        if (table == null) {
            return builder.build();
        }
        try {
            String quote = table.getString("preferred_quote");
            if (quote != null) {
                builder.preferredQuote(quote);
            }
            Boolean indentSequences = table.getBoolean("indent_sequences");
            if (indentSequences != null) {
                builder.indentSequences(indentSequences);
            }
            Long width = table.getLong("width");
            if (width != null) {
                builder.width(Math.toIntExact(width));
            }
            return builder.build();
        } catch (TomlInvalidTypeException | ArithmeticException | IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid formatter configuration " + source + ": " + ex.getMessage(), ex);
        }
    }
}
