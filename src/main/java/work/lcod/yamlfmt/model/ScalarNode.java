package work.lcod.yamlfmt.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Scalar node. {@code text} is the scalar content (unescaped for quoted styles, the source text
 * for plain ones); {@code value} is its typed Java form.
 */
public final class ScalarNode extends Node {
    private String text;
    private ScalarType type;
    private ScalarStyle style;
    private Object value;
    private LegacyOctal legacyOctal;
    private List<String> foldedLines;

    public ScalarNode(String text, ScalarType type, ScalarStyle style, Object value) {
        this.text = Objects.requireNonNull(text, "text");
        this.type = Objects.requireNonNull(type, "type");
        this.style = Objects.requireNonNull(style, "style");
        this.value = value;
    }

    /**
     * Builds a plain scalar for a Java value; strings that need quoting are quoted on dump.
     */
    public static ScalarNode of(Object value) {
        var node = new ScalarNode("", ScalarType.NULL, ScalarStyle.PLAIN, null);
        node.setValue(value);
        return node;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SCALAR;
    }

    public String text() {
        return text;
    }

    public ScalarType type() {
        return type;
    }

    public ScalarStyle style() {
        return style;
    }

    public void setStyle(ScalarStyle style) {
        this.style = Objects.requireNonNull(style, "style");
        if (style != ScalarStyle.FOLDED) {
            foldedLines = null;
        }
    }

    public LegacyOctal legacyOctal() {
        return legacyOctal;
    }

    public void setLegacyOctal(LegacyOctal legacyOctal) {
        this.legacyOctal = legacyOctal;
        if (legacyOctal != null) {
            this.text = legacyOctal.render();
        }
    }

    /**
     * Source lines of a folded block scalar (relative indentation kept), or {@code null} when the
     * value was not read from a folded block.
     */
    public List<String> foldedLines() {
        return foldedLines;
    }

    public void setFoldedLines(List<String> foldedLines) {
        this.foldedLines = foldedLines == null ? null : List.copyOf(foldedLines);
    }

    /**
     * Replaces the value. An integer replacing a legacy octal keeps the octal notation.
     */
    public void setValue(Object newValue) {
        foldedLines = null;
        if (newValue == null) {
            update("", ScalarType.NULL, null);
            legacyOctal = null;
        } else if (newValue instanceof Boolean bool) {
            update(bool.toString(), ScalarType.BOOL, bool);
            legacyOctal = null;
        } else if (newValue instanceof Integer || newValue instanceof Long
            || newValue instanceof Short || newValue instanceof Byte || newValue instanceof BigInteger) {
            var integer = newValue instanceof BigInteger big ? big : BigInteger.valueOf(((Number) newValue).longValue());
            if (legacyOctal != null) {
                legacyOctal = legacyOctal.withValue(integer);
                update(legacyOctal.render(), ScalarType.INT, integer);
            } else {
                update(integer.toString(), ScalarType.INT, integer);
            }
        } else if (newValue instanceof Double || newValue instanceof Float || newValue instanceof BigDecimal) {
            double number = ((Number) newValue).doubleValue();
            update(formatFloat(number), ScalarType.FLOAT, number);
            legacyOctal = null;
        } else {
            String string = newValue.toString();
            update(string, ScalarType.STR, string);
            legacyOctal = null;
        }
    }

    private void update(String newText, ScalarType newType, Object newValue) {
        this.text = newText;
        this.type = newType;
        this.value = newValue;
        if (newType != ScalarType.STR) {
            style = ScalarStyle.PLAIN;
        }
    }

    private static String formatFloat(double number) {
        if (Double.isNaN(number)) {
            return ".nan";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? ".inf" : "-.inf";
        }
        return Double.toString(number);
    }

    @Override
    public Object toJava() {
        return value;
    }
}
