package work.lcod.yamlfmt.load;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import work.lcod.yamlfmt.model.YamlVersion;

class LegacyOctalPreserverTest {
    @Test
    void recordsUnderscoreGrouping() {
        var octal = LegacyOctalPreserver.classify("0_17", YamlVersion.V1_1).orElseThrow();

        assertEquals(BigInteger.valueOf(15), octal.value());
        assertEquals(3, octal.width());
        assertEquals(2, octal.underscoreGroup());
        assertFalse(octal.signPresent());
        assertEquals("0_17", octal.render());
    }

    @Test
    void recordsSign() {
        var negative = LegacyOctalPreserver.classify("-0755", YamlVersion.V1_1).orElseThrow();
        var positive = LegacyOctalPreserver.classify("+017", YamlVersion.V1_1).orElseThrow();

        assertEquals(BigInteger.valueOf(-493), negative.value());
        assertTrue(negative.signPresent());
        assertEquals("-0755", negative.render());
        assertEquals("+017", positive.render());
    }

    @Test
    void ignoresOtherIntegers() {
        assertTrue(LegacyOctalPreserver.classify("17", YamlVersion.V1_1).isEmpty());
        assertTrue(LegacyOctalPreserver.classify("0", YamlVersion.V1_1).isEmpty());
        assertTrue(LegacyOctalPreserver.classify("0x1F", YamlVersion.V1_1).isEmpty());
        assertTrue(LegacyOctalPreserver.classify("0b101", YamlVersion.V1_1).isEmpty());
    }

    @Test
    void neverMarksModernVersions() {
        assertTrue(LegacyOctalPreserver.classify("017", YamlVersion.V1_2).isEmpty());
    }

    @Test
    void rejectsInvalidLiterals() {
        assertThrows(YamlParseException.class, () -> LegacyOctalPreserver.classify("09", YamlVersion.V1_1));
    }
}
