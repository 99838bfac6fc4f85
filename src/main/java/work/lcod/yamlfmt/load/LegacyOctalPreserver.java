package work.lcod.yamlfmt.load;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.yamlfmt.model.LegacyOctal;
import work.lcod.yamlfmt.model.ScalarResolver;
import work.lcod.yamlfmt.model.YamlVersion;

/**
 * Detects YAML 1.1 octal integers ({@code 0644}, {@code -0_17}) and records what is needed to
 * write them back unchanged. Newer versions never produce a marker.
 */
public final class LegacyOctalPreserver {
    private static final Pattern LEGACY_OCTAL = Pattern.compile("^[-+]?0[0-7_]+$");

    private LegacyOctalPreserver() {}

    /**
     * @throws YamlParseException when the literal does not parse as an integer under {@code version}
     */
    public static Optional<LegacyOctal> classify(String literal, YamlVersion version) {
        if (!version.isLegacy()) {
            return Optional.empty();
        }
        BigInteger value;
        try {
            value = ScalarResolver.parseInteger(literal, version);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new YamlParseException("invalid integer literal '" + literal + "' for YAML " + version, 0, 0, ex);
        }
        String trimmed = literal.trim();
        String digits = trimmed.replace("_", "");
        boolean signPresent = false;
        if (digits.startsWith("+") || digits.startsWith("-")) {
            signPresent = true;
            digits = digits.substring(1);
        }
        if (!digits.startsWith("0") || !LEGACY_OCTAL.matcher(trimmed).matches() || digits.length() < 2) {
            return Optional.empty();
        }
        return Optional.of(new LegacyOctal(value, digits.length(), underscoreGroup(trimmed), signPresent));
    }

    private static int underscoreGroup(String literal) {
        String stripped = literal;
        while (stripped.endsWith("_")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        int last = stripped.lastIndexOf('_');
        return last < 0 ? 0 : stripped.length() - last - 1;
    }
}
