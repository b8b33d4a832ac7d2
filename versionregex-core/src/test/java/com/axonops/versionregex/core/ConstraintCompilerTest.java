package com.axonops.versionregex.core;

import com.axonops.versionregex.api.ConstraintParser;
import com.axonops.versionregex.api.DialectUnsupportedException;
import com.axonops.versionregex.api.Operator;
import com.axonops.versionregex.api.VersionConstraint;
import com.axonops.versionregex.api.VersionParseException;
import com.axonops.versionregex.dialect.CompiledRegex;
import com.axonops.versionregex.dialect.RegexDialect;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class ConstraintCompilerTest {

    private static final ConstraintCompiler JAVA = new ConstraintCompiler(RegexDialect.JAVA);
    private static final ConstraintCompiler RE2 = new ConstraintCompiler(RegexDialect.RE2);

    private static String generate(String constraint) {
        return JAVA.compile(ConstraintParser.parse(constraint));
    }

    private static CompiledRegex regex(String constraint) {
        return RegexDialect.JAVA.compile(generate(constraint));
    }

    private static void assertMatches(String constraint, String... versions) {
        CompiledRegex regex = regex(constraint);
        for (String version : versions) {
            assertThat(regex.matches(version))
                .as("'%s' should match %s (pattern %s)", version, constraint, regex.pattern())
                .isTrue();
        }
    }

    private static void assertRejects(String constraint, String... versions) {
        CompiledRegex regex = regex(constraint);
        for (String version : versions) {
            assertThat(regex.matches(version))
                .as("'%s' should not match %s (pattern %s)", version, constraint, regex.pattern())
                .isFalse();
        }
    }

    @Nested
    class Caret {
        @Test
        void testCaretStableMajor() {
            assertMatches("^1.2.3", "1.2.3", "1.9.9", "1.0.0", "1.2.3-beta.1");
            assertRejects("^1.2.3", "2.0.0", "0.9.9", "11.2.3");
        }

        @Test
        void testCaretZeroMajor() {
            assertMatches("^0.2.3", "0.2.3", "0.2.9");
            assertRejects("^0.2.3", "0.3.0", "1.2.3");
        }

        @Test
        void testCaretPatternShape() {
            assertThat(generate("^1.2.3")).isEqualTo("^1\\.\\d+\\.\\d+" + RegexFragments.SUFFIX + "$");
        }
    }

    @Nested
    class Tilde {
        @Test
        void testTildeWithinMinor() {
            assertMatches("~1.2.3", "1.2.0", "1.2.3", "1.2.99");
            assertRejects("~1.2.3", "1.3.0", "2.2.3");
        }

        @Test
        void testPessimisticAndCompatibleShareTilde() {
            assertThat(generate("~>1.2")).isEqualTo(generate("~1.2.0"));
            assertThat(generate("~=1.4.2")).isEqualTo(generate("~1.4.2"));
        }
    }

    @Nested
    class Comparison {
        @Test
        void testGreaterOrEqual() {
            assertMatches(">=1.2.3", "1.2.3", "1.2.4", "2.0.0", "1.10.0");
            assertRejects(">=1.2.3", "1.2.2", "0.9.9", "1.1.99");
        }

        @Test
        void testGreaterThan() {
            assertMatches(">1.2.3", "1.2.4", "1.3.0", "10.0.0");
            assertRejects(">1.2.3", "1.2.3", "1.2.2");
        }

        @Test
        void testLessOrEqual() {
            assertMatches("<=2.0.0", "2.0.0", "1.99.99", "0.0.0");
            assertRejects("<=2.0.0", "2.0.1", "3.0.0");
        }

        @Test
        void testLessThan() {
            assertMatches("<1.0.0", "0.9.9", "0.0.0");
            assertRejects("<1.0.0", "1.0.0", "1.0.1");
        }

        @Test
        void testLessThanZeroMatchesNothing() {
            assertThat(generate("<0.0.0")).isEqualTo(RegexFragments.NEVER_MATCHES);
            assertRejects("<0.0.0", "0.0.0", "0.0.1", "");
        }

        @Test
        void testShortLiteralPadsWithZeros() {
            assertMatches(">=1.2", "1.2.0", "1.3.0");
            assertRejects(">=1.2", "1.1.9");
        }

        @Test
        void testSuffixedCandidatesCompareOnTheirCore() {
            assertMatches(">=1.2.3", "1.2.3-beta", "1.2.4+build.1");
        }
    }

    @Nested
    class Exact {
        @Test
        void testPinnedPreReleaseMatchesLiterally() {
            assertMatches("==1.2.3-dev", "1.2.3-dev", "1.2.3-dev+build.9");
            assertRejects("==1.2.3-dev", "1.2.3", "1.2.3-dev.1");
        }

        @Test
        void testPinnedBuildMatchesLiterally() {
            assertMatches("1.2.3+build.123", "1.2.3+build.123");
            assertRejects("1.2.3+build.123", "1.2.3", "1.2.3+build.124");
        }

        @Test
        void testUnpinnedSuffixIsOptional() {
            assertMatches("=1.2.3", "1.2.3", "1.2.3-beta", "1.2.3+b");
            assertRejects("=1.2.3", "1.2.4", "1.2.30", "11.2.3");
        }

        @Test
        void testEqualAndExactProduceSamePattern() {
            assertThat(generate("=1.2.3")).isEqualTo(generate("==1.2.3")).isEqualTo(generate("1.2.3"));
        }

        @Test
        void testWildcard() {
            assertMatches("1.*", "1.0.0", "1.999.999");
            assertRejects("1.*", "2.0.0", "0.9.9");
            assertMatches("1.*.3", "1.0.3");
            assertRejects("1.*.3", "1.0.4");
        }

        @Test
        void testGoVersion() {
            assertMatches("v1.2.3", "v1.2.3", "v1.2.3-rc.1");
            assertRejects("v1.2.3", "1.2.3", "v1.2.4");
        }

        @Test
        void testMultiSegment() {
            assertMatches("1.0.0.0", "1.0.0.0", "1.0.0.0-beta2");
            assertRejects("1.0.0.0", "1.0.0.1", "1.0.0");
        }

        @Test
        void testNuGetLabelAcceptsBuildLikeOtherPinnedPreReleases() {
            assertMatches("==1.2.3-beta", "1.2.3-beta", "1.2.3-beta+build.5");
            assertMatches("==1.2.3-dev", "1.2.3-dev+build.5");
            assertRejects("==1.2.3-beta", "1.2.3", "1.2.3-beta2");
        }

        @Test
        void testEmptyVersionRejected() {
            assertThatThrownBy(() -> generate("=="))
                .isInstanceOf(VersionParseException.class)
                .hasMessageContaining("version is empty");
        }

        @Test
        void testNonNumericComponentRejected() {
            assertThatThrownBy(() -> generate("==1.a.3"))
                .isInstanceOf(VersionParseException.class)
                .satisfies(e -> assertThat(((VersionParseException) e).getComponent()).isEqualTo("minor"));
        }
    }

    @Nested
    class NotEqual {
        @Test
        void testNotEqualOnJava() {
            assertMatches("!=1.2.3", "1.2.4", "1.2", "2", "0.0.1-alpha");
            assertRejects("!=1.2.3", "1.2.3", "1.2.3-beta", "v1.2.4", "");
        }

        @Test
        void testNotEqualUsesLookahead() {
            assertThat(generate("!=1.2.3")).startsWith("^(?!");
        }

        @Test
        void testNotEqualRejectedOnRe2() {
            VersionConstraint constraint = ConstraintParser.parse("!=1.2.3");

            assertThatThrownBy(() -> RE2.compile(constraint))
                .isInstanceOf(DialectUnsupportedException.class)
                .hasMessageContaining("!=1.2.3")
                .hasMessageContaining("negative lookahead")
                .satisfies(e -> {
                    DialectUnsupportedException de = (DialectUnsupportedException) e;
                    assertThat(de.getDialect()).isEqualTo(RegexDialect.RE2);
                    assertThat(de.getFeature()).isEqualTo("negative lookahead");
                    assertThat(de.getConstraint()).isEqualTo("!=1.2.3");
                });
        }
    }

    @Nested
    class MavenRange {
        @Test
        void testHalfOpenRange() {
            assertMatches("[1.0,2.0)", "1.0.0", "1.9.9", "1.0.0-SNAPSHOT");
            assertRejects("[1.0,2.0)", "2.0.0", "0.9.9");
        }

        @Test
        void testUpperBoundOnly() {
            assertMatches("(,1.0]", "0.5.0", "1.0.0");
            assertRejects("(,1.0]", "1.0.1");
        }

        @Test
        void testUnionOfRanges() {
            assertMatches("[1.0,2.0),[3.0,)", "1.5.0", "3.0.0", "42.0.0");
            assertRejects("[1.0,2.0),[3.0,)", "2.5.0", "0.1.0");
        }

        @Test
        void testUnboundedMatchesAnyVersion() {
            assertThat(generate("(,)")).isEqualTo(RegexFragments.ANY_VERSION);
        }

        @Test
        void testOperatorIsMavenRange() {
            assertThat(ConstraintParser.parse("[1.0,2.0)").operator()).isEqualTo(Operator.MAVEN_RANGE);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"^1.2.3", "^0.2.3", "~1.2.3", "~>2.1", "~=3.0.1", ">=1.2.3", ">1.2.3",
        "<=4.5.6", "<10.0.0", "<0.0.0", "==1.2.3-dev", "1.2.3+b", "1.*", "v1.2.3-beta",
        "v0.0.0-20191109021931-daa7c04131f5", "1.0.0.0", "2.1.0-preview1", "[1.0,2.0)", "(,1.0]",
        "[1.5]", "[1.0,2.0),[3.0,)", "(,)"})
    void testPatternsCompileInBothDialects(String constraint) {
        VersionConstraint parsed = ConstraintParser.parse(constraint);
        String javaPattern = JAVA.compile(parsed);
        String re2Pattern = RE2.compile(parsed);

        assertThat(re2Pattern).isEqualTo(javaPattern);
        assertThatCode(() -> RegexDialect.JAVA.compile(javaPattern)).doesNotThrowAnyException();
        assertThatCode(() -> RegexDialect.RE2.compile(re2Pattern)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"^1.2.3", "!=1.2.3", ">=9999999999.0.0", "[1.0,2.0),[3.0,)", "1.*"})
    void testCompilationIsIdempotent(String constraint) {
        String first = generate(constraint);
        String second = generate(constraint);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void testDialectAccessor() {
        assertThat(RE2.dialect()).isEqualTo(RegexDialect.RE2);
    }

    @Test
    void testNullConstraintRejected() {
        assertThatThrownBy(() -> JAVA.compile(null)).isInstanceOf(NullPointerException.class);
    }
}
