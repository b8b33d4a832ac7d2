package com.axonops.versionregex.api;

import com.axonops.versionregex.cache.VersionPatternCache;
import com.axonops.versionregex.core.RegexFragments;
import com.axonops.versionregex.dialect.RegexDialect;
import com.axonops.versionregex.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class VersionRegexTest {

    private VersionPatternCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    void testToRegexProducesStandalonePattern() {
        String regex = VersionRegex.toRegex(">=1.2.3");

        assertThat(regex).startsWith("^").endsWith("$");
        assertThat(Pattern.matches(regex, "1.2.3")).isTrue();
        assertThat(Pattern.matches(regex, "1.2.2")).isFalse();
    }

    @Test
    void testToRegexIsPure() {
        String first = VersionRegex.toRegex("[1.0,2.0),[3.0,)");
        String second = VersionRegex.toRegex("[1.0,2.0),[3.0,)");

        assertThat(second).isEqualTo(first);
        assertThat(VersionPattern.getCacheStatistics().totalRequests()).isZero();
    }

    @Test
    void testToRegexFollowsGlobalDialect() {
        assertThat(VersionRegex.toRegex("!=1.0.0")).contains("(?!");

        VersionPattern.configureCache(TestUtils.testConfigBuilder().dialect(RegexDialect.RE2).build());

        assertThatThrownBy(() -> VersionRegex.toRegex("!=1.0.0"))
            .isInstanceOf(DialectUnsupportedException.class);
    }

    @Test
    void testToRegexWithDialect() {
        assertThatThrownBy(() -> VersionRegex.toRegex("!=1.0.0", RegexDialect.RE2))
            .isInstanceOf(DialectUnsupportedException.class);
        assertThat(VersionRegex.toRegex("<0.0.0", RegexDialect.RE2)).isEqualTo(RegexFragments.NEVER_MATCHES);
        assertThatThrownBy(() -> VersionRegex.toRegex("1.0.0", null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testErrorsPropagate() {
        assertThatThrownBy(() -> VersionRegex.toRegex("^1.two.3"))
            .isInstanceOf(VersionParseException.class)
            .hasMessageContaining("two")
            .hasMessageContaining("minor");
        assertThatThrownBy(() -> VersionRegex.toRegex("[1.0"))
            .isInstanceOf(VersionRegexException.class);
    }

    @Test
    void testMatches() {
        assertThat(VersionRegex.matches("1.9.9", "^1.2.3")).isTrue();
        assertThat(VersionRegex.matches("0.3.0", "^0.2.3")).isFalse();
        assertThat(VersionRegex.matches("v1.4.0", "v1.4.0")).isTrue();
    }

    @Test
    void testFilter() {
        List<String> versions = List.of("1.0.0", "1.5.0", "2.0.0", "2.1.0-beta");

        assertThat(VersionRegex.filter("[1.0,2.0]", versions)).containsExactly("1.0.0", "1.5.0", "2.0.0");
    }

    @Test
    void testCompileDelegatesToCache() {
        VersionPattern pattern = VersionRegex.compile("~1.2.0");

        assertThat(VersionRegex.compile("~1.2.0")).isSameAs(pattern);
        assertThat(VersionRegex.compile("~1.2.0", RegexDialect.RE2).dialect()).isEqualTo(RegexDialect.RE2);
    }

    @Test
    void testQuoteMeta() {
        String quoted = VersionRegex.quoteMeta("1.0.0+build[x]");

        assertThat(quoted).isEqualTo("1\\.0\\.0\\+build\\[x\\]");
        assertThat(Pattern.matches(quoted, "1.0.0+build[x]")).isTrue();
        assertThat(RegexDialect.RE2.compile(quoted).matches("1.0.0+build[x]")).isTrue();
    }
}
