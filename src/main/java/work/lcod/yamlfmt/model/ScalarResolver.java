package work.lcod.yamlfmt.model;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Implicit type resolution for plain scalars, following the YAML 1.1 type repository or the
 * YAML 1.2 core schema depending on the active version.
 */
public final class ScalarResolver {
    private static final Pattern NULL_11 = Pattern.compile("^(?:~|null|Null|NULL)?$");
    private static final Pattern BOOL_11 = Pattern.compile(
        "^(?:yes|Yes|YES|no|No|NO|true|True|TRUE|false|False|FALSE|on|On|ON|off|Off|OFF)$");
    private static final Pattern INT_11 = Pattern.compile(
        "^(?:[-+]?0b[0-1_]+|[-+]?0[0-7_]+|[-+]?(?:0|[1-9][0-9_]*)|[-+]?0x[0-9a-fA-F_]+"
            + "|[-+]?[1-9][0-9_]*(?::[0-5]?[0-9])+)$");
    private static final Pattern FLOAT_11 = Pattern.compile(
        "^(?:[-+]?(?:[0-9][0-9_]*)\\.[0-9_]*(?:[eE][-+]?[0-9]+)?|\\.[0-9_]+(?:[eE][-+]?[0-9]+)?"
            + "|[-+]?[0-9][0-9_]*(?::[0-5]?[0-9])+\\.[0-9_]*|[-+]?\\.(?:inf|Inf|INF)|\\.(?:nan|NaN|NAN))$");

    private static final Pattern NULL_12 = Pattern.compile("^(?:~|null|Null|NULL)?$");
    private static final Pattern BOOL_12 = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
    private static final Pattern INT_12 = Pattern.compile("^(?:[-+]?[0-9]+|0o[0-7]+|0x[0-9a-fA-F]+)$");
    private static final Pattern FLOAT_12 = Pattern.compile(
        "^(?:[-+]?(?:\\.[0-9]+|[0-9]+(?:\\.[0-9]*)?)(?:[eE][-+]?[0-9]+)?|[-+]?\\.(?:inf|Inf|INF)|\\.(?:nan|NaN|NAN))$");

    private ScalarResolver() {}

    public static ScalarType resolve(String text, YamlVersion version) {
        if (usesCoreSchema(version)) {
            if (NULL_12.matcher(text).matches()) {
                return ScalarType.NULL;
            }
            if (BOOL_12.matcher(text).matches()) {
                return ScalarType.BOOL;
            }
            if (INT_12.matcher(text).matches()) {
                return ScalarType.INT;
            }
            if (FLOAT_12.matcher(text).matches()) {
                return ScalarType.FLOAT;
            }
            return ScalarType.STR;
        }
        if (NULL_11.matcher(text).matches()) {
            return ScalarType.NULL;
        }
        if (BOOL_11.matcher(text).matches()) {
            return ScalarType.BOOL;
        }
        if (INT_11.matcher(text).matches()) {
            return ScalarType.INT;
        }
        if (FLOAT_11.matcher(text).matches()) {
            return ScalarType.FLOAT;
        }
        return ScalarType.STR;
    }

    /**
     * Parses an integer literal under the rules of {@code version}.
     *
     * @throws NumberFormatException when the text is not an integer literal for that version
     */
    public static BigInteger parseInteger(String text, YamlVersion version) {
        String raw = text.trim();
        if (usesCoreSchema(version)) {
            if (!INT_12.matcher(raw).matches()) {
                throw new NumberFormatException("not a YAML " + version + " integer: " + text);
            }
            if (raw.startsWith("0o")) {
                return new BigInteger(raw.substring(2), 8);
            }
            if (raw.startsWith("0x")) {
                return new BigInteger(raw.substring(2), 16);
            }
            return new BigInteger(raw.startsWith("+") ? raw.substring(1) : raw);
        }
        if (!INT_11.matcher(raw).matches()) {
            throw new NumberFormatException("not a YAML " + version + " integer: " + text);
        }
        String digits = raw.replace("_", "");
        boolean negative = false;
        if (digits.startsWith("-") || digits.startsWith("+")) {
            negative = digits.charAt(0) == '-';
            digits = digits.substring(1);
        }
        BigInteger value;
        if (digits.startsWith("0b")) {
            value = new BigInteger(digits.substring(2), 2);
        } else if (digits.startsWith("0x")) {
            value = new BigInteger(digits.substring(2), 16);
        } else if (digits.contains(":")) {
            value = BigInteger.ZERO;
            for (String part : digits.split(":")) {
                value = value.multiply(BigInteger.valueOf(60)).add(new BigInteger(part));
            }
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            value = new BigInteger(digits.substring(1), 8);
        } else {
            value = new BigInteger(digits);
        }
        return negative ? value.negate() : value;
    }

    /**
     * Parses a float literal under the rules of {@code version}.
     *
     * @throws NumberFormatException when the text is not a float literal for that version
     */
    public static double parseFloat(String text, YamlVersion version) {
        String raw = text.trim();
        Pattern pattern = usesCoreSchema(version) ? FLOAT_12 : FLOAT_11;
        if (!pattern.matcher(raw).matches() && resolve(raw, version) != ScalarType.INT) {
            throw new NumberFormatException("not a YAML " + version + " float: " + text);
        }
        String digits = raw.replace("_", "");
        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".inf")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (lower.equals(".nan")) {
            return Double.NaN;
        }
        if (digits.contains(":")) {
            boolean negative = digits.startsWith("-");
            String unsigned = digits.startsWith("-") || digits.startsWith("+") ? digits.substring(1) : digits;
            double value = 0;
            for (String part : unsigned.split(":")) {
                value = value * 60 + Double.parseDouble(part);
            }
            return negative ? -value : value;
        }
        return Double.parseDouble(digits);
    }

    public static boolean parseBoolean(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return lower.equals("true") || lower.equals("yes") || lower.equals("on");
    }

    private static boolean usesCoreSchema(YamlVersion version) {
        return version.major() > 1 || (version.major() == 1 && version.minor() >= 2);
    }
}
