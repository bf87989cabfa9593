package bouncer.core.service.function;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.definition.PatternMode;

@DisplayName("GlobPatternMatcher")
class GlobPatternMatcherTest {

    @Nested
    @DisplayName("full glob syntax")
    class FullModeTests {

        private final GlobPatternMatcher matcher = new GlobPatternMatcher(MatchingOptions.defaults());

        @Test
        @DisplayName("should match double star across segments")
        void shouldMatchDoubleStar() {
            assertTrue(matcher.matches("/api/users/123", "/api/**"));
            assertFalse(matcher.matches("/other/users", "/api/**"));
        }

        @Test
        @DisplayName("should keep single star within one segment")
        void shouldMatchSingleStar() {
            assertTrue(matcher.matches("/api/users", "/api/*"));
            assertFalse(matcher.matches("/api/users/123", "/api/*"));
        }

        @Test
        @DisplayName("should normalize trailing and repeated slashes")
        void shouldNormalizePath() {
            assertTrue(matcher.matches("/api//health/", "/api/health"));
        }

        @Test
        @DisplayName("should support alternatives")
        void shouldMatchAlternatives() {
            assertTrue(matcher.matches("/q/health", "/q/{health,metrics}"));
            assertFalse(matcher.matches("/q/openapi", "/q/{health,metrics}"));
        }
    }

    @Nested
    @DisplayName("wildcard-only syntax")
    class WildcardModeTests {

        private final GlobPatternMatcher matcher =
                new GlobPatternMatcher(MatchingOptions.defaults().withPatternMode(PatternMode.WILDCARD));

        @Test
        @DisplayName("should treat leading and trailing stars as wildcards")
        void shouldMatchEdges() {
            assertTrue(matcher.matches("/api/users/1", "/api/*"));
            assertTrue(matcher.matches("report.pdf", "*.pdf"));
            assertTrue(matcher.matches("/a/secret/b", "*secret*"));
            assertTrue(matcher.matches("anything", "*"));
        }

        @Test
        @DisplayName("should compare other characters literally")
        void shouldBeLiteral() {
            assertFalse(matcher.matches("/api/users", "/api/{users,groups}"));
            assertTrue(matcher.matches("/api/{users,groups}", "/api/{users,groups}"));
        }
    }

    @Test
    @DisplayName("should ignore case when configured")
    void shouldIgnoreCase() {
        final var matcher = new GlobPatternMatcher(MatchingOptions.defaults().withCaseSensitive(false));

        assertTrue(matcher.matches("/API/Users", "/api/*"));
    }
}
