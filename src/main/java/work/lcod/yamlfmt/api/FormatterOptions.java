package work.lcod.yamlfmt.api;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable dump settings of a {@link FormattedYaml} instance.
 */
public record FormatterOptions(
    QuoteStyle preferredQuote,
    boolean indentSequences,
    int width,
    int mapIndent
) {
    public static final int DEFAULT_WIDTH = 120;
    public static final int DEFAULT_MAP_INDENT = 2;

    public FormatterOptions {
        Objects.requireNonNull(preferredQuote, "preferredQuote");
        if (width < 20) {
            throw new IllegalArgumentException("width must be at least 20: " + width);
        }
        if (mapIndent < 1 || mapIndent > 9) {
            throw new IllegalArgumentException("mapIndent must be between 1 and 9: " + mapIndent);
        }
    }

    public static FormatterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .preferredQuote(preferredQuote)
            .indentSequences(indentSequences)
            .width(width)
            .mapIndent(mapIndent);
    }

    public static final class Builder {
        private static final Logger LOGGER = LoggerFactory.getLogger(FormatterOptions.class);

        private QuoteStyle preferredQuote = QuoteStyle.DOUBLE;
        private boolean indentSequences = true;
        private int width = DEFAULT_WIDTH;
        private int mapIndent = DEFAULT_MAP_INDENT;

        public Builder preferredQuote(QuoteStyle preferredQuote) {
            this.preferredQuote = preferredQuote;
            return this;
        }

        /**
         * Sets the preferred quote from its character. Anything but {@code "} or {@code '} is
         * ignored and the current setting is kept.
         */
        public Builder preferredQuote(String raw) {
            QuoteStyle.from(raw).ifPresentOrElse(
                style -> this.preferredQuote = style,
                () -> LOGGER.debug("Ignoring unsupported preferred quote {}", raw)
            );
            return this;
        }

        public Builder indentSequences(boolean indentSequences) {
            this.indentSequences = indentSequences;
            return this;
        }

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder mapIndent(int mapIndent) {
            this.mapIndent = mapIndent;
            return this;
        }

        public FormatterOptions build() {
            return new FormatterOptions(preferredQuote, indentSequences, width, mapIndent);
        }
    }
}
