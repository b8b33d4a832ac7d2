package com.axonops.versionregex.core;

import com.axonops.versionregex.api.VersionParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class VersionTripleTest {

    @Test
    void testParseFullVersion() {
        assertThat(VersionTriple.parse("1.2.3")).isEqualTo(new VersionTriple(1, 2, 3));
    }

    @Test
    void testMissingComponentsDefaultToZero() {
        assertThat(VersionTriple.parse("1")).isEqualTo(new VersionTriple(1, 0, 0));
        assertThat(VersionTriple.parse("4.7")).isEqualTo(new VersionTriple(4, 7, 0));
    }

    @Test
    void testSuffixIgnored() {
        assertThat(VersionTriple.parse("1.2.3-beta.1")).isEqualTo(new VersionTriple(1, 2, 3));
        assertThat(VersionTriple.parse("1.2.3+build.5")).isEqualTo(new VersionTriple(1, 2, 3));
        assertThat(VersionTriple.parse("1.2.3-rc+exp-sha")).isEqualTo(new VersionTriple(1, 2, 3));
    }

    @Test
    void testExtraComponentsIgnored() {
        assertThat(VersionTriple.parse("1.2.3.4")).isEqualTo(new VersionTriple(1, 2, 3));
    }

    @Test
    void testNonNumericComponentRejected() {
        assertThatThrownBy(() -> VersionTriple.parse("1.x.3"))
            .isInstanceOf(VersionParseException.class)
            .satisfies(e -> {
                VersionParseException pe = (VersionParseException) e;
                assertThat(pe.getComponent()).isEqualTo("minor");
                assertThat(pe.getInvalidText()).isEqualTo("x");
                assertThat(pe.getLiteral()).isEqualTo("1.x.3");
            });
    }

    @Test
    void testEmptyComponentRejected() {
        assertThatThrownBy(() -> VersionTriple.parse("1..3"))
            .isInstanceOf(VersionParseException.class)
            .hasMessageContaining("component is empty");
        assertThatThrownBy(() -> VersionTriple.parse(""))
            .isInstanceOf(VersionParseException.class)
            .hasMessageContaining("major");
    }

    @Test
    void testOversizedComponentRejected() {
        assertThatThrownBy(() -> VersionTriple.parse("10000000000.0.0"))
            .isInstanceOf(VersionParseException.class)
            .hasMessageContaining("exceeds");
        assertThatThrownBy(() -> VersionTriple.parse("1.2.12345678901234567890"))
            .isInstanceOf(VersionParseException.class)
            .hasMessageContaining("too many digits");
    }

    @Test
    void testStripSuffix() {
        assertThat(VersionTriple.stripSuffix("1.2.3-alpha+b")).isEqualTo("1.2.3");
        assertThat(VersionTriple.stripSuffix("1.2.3+b-1")).isEqualTo("1.2.3");
        assertThat(VersionTriple.stripSuffix("1.2.3")).isEqualTo("1.2.3");
    }

    @Test
    void testComponentNames() {
        assertThat(VersionTriple.componentName(0)).isEqualTo("major");
        assertThat(VersionTriple.componentName(2)).isEqualTo("patch");
        assertThat(VersionTriple.componentName(3)).isEqualTo("revision");
        assertThat(VersionTriple.componentName(5)).isEqualTo("segment 6");
    }

    @Test
    void testConstructorRejectsOutOfDomain() {
        assertThatThrownBy(() -> new VersionTriple(-1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VersionTriple(0, 0, DigitRangeSynthesizer.MAX_VALUE + 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToString() {
        assertThat(VersionTriple.parse("7.0-rc1")).hasToString("7.0.0");
    }
}
