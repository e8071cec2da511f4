package de.mirkosertic.mcp.docsimilarity.tfidf;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void shouldLowercaseAndStripPunctuation() {
        assertThat(TextNormalizer.normalize("Hello, World!")).isEqualTo("hello world");
    }

    @Test
    void shouldCollapseWhitespaceRuns() {
        assertThat(TextNormalizer.normalize("  Multiple   spaces\t\nhere  ")).isEqualTo("multiple spaces here");
    }

    @Test
    void shouldReplacePunctuationWithSeparator() {
        assertThat(TextNormalizer.normalize("don't stop-now")).isEqualTo("don t stop now");
        assertThat(TextNormalizer.normalize("a.b,c;d")).isEqualTo("a b c d");
    }

    @Test
    void shouldLeaveNonAsciiCharactersUntouched() {
        assertThat(TextNormalizer.normalize("Grüße aus München")).isEqualTo("grüße aus münchen");
        assertThat(TextNormalizer.normalize("ÄÖÜ café")).isEqualTo("ÄÖÜ café");
    }

    @Test
    void shouldTreatUnicodeSpacesAsSeparators() {
        assertThat(TextNormalizer.normalize("Hello\u00A0World")).isEqualTo("hello world");
        assertThat(TextNormalizer.normalize("a\u2007b\u202Fc\u0085d\u3000e\u2028f")).isEqualTo("a b c d e f");
    }

    @Test
    void shouldKeepInformationSeparatorsInsideTokens() {
        assertThat(TextNormalizer.normalize("a\u001Cb \u001Fc")).isEqualTo("a\u001Cb \u001Fc");
    }

    @Test
    void shouldClassifyUnicodeWhiteSpace() {
        for (final char c : " \t\n\u000B\f\r\u0085\u00A0\u1680\u2000\u2007\u200A\u2028\u2029\u202F\u205F\u3000".toCharArray()) {
            assertThat(TextNormalizer.isWhitespace(c)).as("whitespace U+%04X", (int) c).isTrue();
        }
        for (final char c : "a0_\u001C\u001D\u001E\u001F\u200B\uFEFF".toCharArray()) {
            assertThat(TextNormalizer.isWhitespace(c)).as("not whitespace U+%04X", (int) c).isFalse();
        }
    }

    @Test
    void shouldKeepDigits() {
        assertThat(TextNormalizer.normalize("Version 2.0 (2024)")).isEqualTo("version 2 0 2024");
    }

    @Test
    void shouldReturnEmptyStringForPunctuationOnlyInput() {
        assertThat(TextNormalizer.normalize("!!! ... ???")).isEmpty();
        assertThat(TextNormalizer.normalize("")).isEmpty();
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void shouldRecognizeEveryAsciiPunctuationCharacter() {
        for (final char c : "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~".toCharArray()) {
            assertThat(TextNormalizer.isAsciiPunctuation(c)).as("punctuation %s", c).isTrue();
        }
        for (final char c : "azAZ09 é".toCharArray()) {
            assertThat(TextNormalizer.isAsciiPunctuation(c)).as("not punctuation %s", c).isFalse();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Hello, World!",
            "  lots   of\twhitespace\n\n",
            "MiXeD CaSe with Ümlauts",
            "punctuation... everywhere!!! (really?)",
            "",
            "already normalized text",
            "no\u00A0break\u202Fspaces\u0085here"
    })
    void shouldBeIdempotent(final String input) {
        final String once = TextNormalizer.normalize(input);
        assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
    }
}
