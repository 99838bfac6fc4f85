package work.lcod.yamlfmt.model;

import java.math.BigInteger;

/**
 * Marker kept on YAML 1.1 octal integers ({@code 0755}, {@code 0_17}) so the literal can be
 * written back in its original shape.
 *
 * @param value integer value of the literal
 * @param width number of digits after the sign, underscores excluded
 * @param underscoreGroup distance between underscores counted from the right, 0 when none
 * @param signPresent whether the literal carried an explicit sign
 */
public record LegacyOctal(BigInteger value, int width, int underscoreGroup, boolean signPresent) {
    public LegacyOctal withValue(BigInteger newValue) {
        return new LegacyOctal(newValue, width, underscoreGroup, signPresent);
    }

    /**
     * Base-8 rendering with a leading {@code 0}, padded to the recorded width.
     */
    public String render() {
        String digits = value.abs().toString(8);
        if (digits.length() < width) {
            digits = "0".repeat(width - digits.length()) + digits;
        }
        if (digits.charAt(0) != '0') {
            digits = "0" + digits;
        }
        if (underscoreGroup > 0) {
            var grouped = new StringBuilder(digits);
            for (int pos = digits.length() - underscoreGroup; pos > 0; pos -= underscoreGroup) {
                grouped.insert(pos, '_');
            }
            digits = grouped.toString();
        }
        if (value.signum() < 0) {
            return "-" + digits;
        }
        return signPresent ? "+" + digits : digits;
    }
}
