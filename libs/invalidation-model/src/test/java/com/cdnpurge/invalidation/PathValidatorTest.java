package com.cdnpurge.invalidation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PathValidator")
class PathValidatorTest {

    @Nested
    @DisplayName("accepted input")
    class Accepted {

        @Test
        @DisplayName("returns paths unchanged when already clean")
        void cleanPaths() {
            var result = PathValidator.validate(List.of("/index.html", "/blog/post-1"));

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.paths()).containsExactly("/index.html", "/blog/post-1");
            assertThat(result.error()).isEmpty();
        }

        @Test
        @DisplayName("collapses duplicates silently, keeping first occurrence order")
        void collapsesDuplicates() {
            var result = PathValidator.validate(List.of("/b", "/a", "/b", "/c", "/a"));

            assertThat(result.valid()).isTrue();
            assertThat(result.paths()).containsExactly("/b", "/a", "/c");
        }

        @Test
        @DisplayName("strips surrounding whitespace before de-duplicating")
        void stripsWhitespace() {
            var result = PathValidator.validate(List.of(" /a ", "/a"));

            assertThat(result.valid()).isTrue();
            assertThat(result.paths()).containsExactly("/a");
        }

        @Test
        @DisplayName("keeps XML-special and non-ASCII characters")
        void keepsSpecialCharacters() {
            var paths = List.of("/test<file>.html", "/test&page.html", "/文件.html", "/emoji-😀");
            var result = PathValidator.validate(paths);

            assertThat(result.valid()).isTrue();
            assertThat(result.paths()).containsExactlyElementsOf(paths);
        }

        @Test
        @DisplayName("accepts the wildcard path")
        void acceptsWildcard() {
            assertThat(PathValidator.validate(List.of("/*")).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @Test
        @DisplayName("empty list fails")
        void emptyList() {
            var result = PathValidator.validate(List.of());

            assertThat(result.valid()).isFalse();
            assertThat(result.paths()).isEmpty();
            assertThat(result.error()).isPresent();
            assertThat(result.errors()).anyMatch(e -> e.contains("empty"));
        }

        @Test
        @DisplayName("null list fails")
        void nullList() {
            assertThat(PathValidator.validate(null).valid()).isFalse();
        }

        @Test
        @DisplayName("path without leading slash fails")
        void missingLeadingSlash() {
            var result = PathValidator.validate(List.of("/ok", "relative/page.html"));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().asString().contains("paths[1]");
        }

        @Test
        @DisplayName("null and blank entries fail")
        void nullAndBlankEntries() {
            var result = PathValidator.validate(Arrays.asList("/ok", null, "   "));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(2);
        }

        @Test
        @DisplayName("control characters fail")
        void controlCharacters() {
            var result = PathValidator.validate(List.of("/line\nbreak", "/nul\u0000"));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(2);
            assertThat(result.errors().get(0)).contains("U+000A");
        }

        @Test
        @DisplayName("unpaired surrogate fails")
        void unpairedSurrogate() {
            var result = PathValidator.validate(List.of("/broken-\uD83D"));

            assertThat(result.valid()).isFalse();
        }

        @Test
        @DisplayName("reports every error at once")
        void reportsAllErrors() {
            var paths = new ArrayList<String>();
            paths.add("a");
            paths.add("b");
            paths.add("/fine");
            paths.add("c");

            var result = PathValidator.validate(paths);

            assertThat(result.errors()).hasSize(3);
            assertThat(result.error().orElseThrow().messages()).hasSize(3);
        }
    }
}
