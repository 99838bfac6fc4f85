package work.lcod.yamlfmt.api;

import java.util.Optional;

/**
 * Quote character preferred for scalars that need quoting.
 */
public enum QuoteStyle {
    DOUBLE('"'),
    SINGLE('\'');

    private final char character;

    QuoteStyle(char character) {
        this.character = character;
    }

    public char character() {
        return character;
    }

    /**
     * Maps {@code "} or {@code '} (or the names {@code double}/{@code single}) to a style.
     */
    public static Optional<QuoteStyle> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim()) {
            case "\"", "double", "DOUBLE" -> Optional.of(DOUBLE);
            case "'", "single", "SINGLE" -> Optional.of(SINGLE);
            default -> Optional.empty();
        };
    }
}
