package work.lcod.yamlfmt.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ScalarResolverTest {
    @Test
    void resolvesLegacyBooleans() {
        assertEquals(ScalarType.BOOL, ScalarResolver.resolve("yes", YamlVersion.V1_1));
        assertEquals(ScalarType.BOOL, ScalarResolver.resolve("Off", YamlVersion.V1_1));
        assertEquals(ScalarType.STR, ScalarResolver.resolve("yes", YamlVersion.V1_2));
        assertEquals(ScalarType.BOOL, ScalarResolver.resolve("TRUE", YamlVersion.V1_2));
        assertTrue(ScalarResolver.parseBoolean("on"));
        assertFalse(ScalarResolver.parseBoolean("no"));
    }

    @Test
    void resolvesNulls() {
        assertEquals(ScalarType.NULL, ScalarResolver.resolve("~", YamlVersion.V1_1));
        assertEquals(ScalarType.NULL, ScalarResolver.resolve("", YamlVersion.V1_2));
        assertEquals(ScalarType.STR, ScalarResolver.resolve("nil", YamlVersion.V1_1));
    }

    @Test
    void parsesLegacyIntegers() {
        assertEquals(BigInteger.valueOf(31), ScalarResolver.parseInteger("0x1F", YamlVersion.V1_1));
        assertEquals(BigInteger.valueOf(5), ScalarResolver.parseInteger("0b101", YamlVersion.V1_1));
        assertEquals(BigInteger.valueOf(1000), ScalarResolver.parseInteger("1_000", YamlVersion.V1_1));
        assertEquals(BigInteger.valueOf(15), ScalarResolver.parseInteger("017", YamlVersion.V1_1));
        assertEquals(BigInteger.valueOf(-15), ScalarResolver.parseInteger("-0_17", YamlVersion.V1_1));
        assertEquals(BigInteger.valueOf(90), ScalarResolver.parseInteger("1:30", YamlVersion.V1_1));
    }

    @Test
    void parsesCoreSchemaIntegers() {
        assertEquals(ScalarType.INT, ScalarResolver.resolve("0o17", YamlVersion.V1_2));
        assertEquals(BigInteger.valueOf(15), ScalarResolver.parseInteger("0o17", YamlVersion.V1_2));
        assertEquals(BigInteger.valueOf(17), ScalarResolver.parseInteger("017", YamlVersion.V1_2));
        assertEquals(ScalarType.STR, ScalarResolver.resolve("1_000", YamlVersion.V1_2));
        assertThrows(NumberFormatException.class, () -> ScalarResolver.parseInteger("1_000", YamlVersion.V1_2));
    }

    @Test
    void parsesFloats() {
        assertEquals(ScalarType.FLOAT, ScalarResolver.resolve("3.14", YamlVersion.V1_1));
        assertEquals(ScalarType.FLOAT, ScalarResolver.resolve(".inf", YamlVersion.V1_2));
        assertEquals(1000.5, ScalarResolver.parseFloat("1_000.5", YamlVersion.V1_1));
        assertEquals(Double.NEGATIVE_INFINITY, ScalarResolver.parseFloat("-.inf", YamlVersion.V1_1));
        assertTrue(Double.isNaN(ScalarResolver.parseFloat(".nan", YamlVersion.V1_2)));
    }

    @Test
    void rejectsNonIntegers() {
        assertThrows(NumberFormatException.class, () -> ScalarResolver.parseInteger("abc", YamlVersion.V1_1));
        assertThrows(NumberFormatException.class, () -> ScalarResolver.parseInteger("09", YamlVersion.V1_1));
    }
}
