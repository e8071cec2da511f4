package de.mirkosertic.mcp.docsimilarity.extraction;

import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileContentExtractor Tests")
class FileContentExtractorTest {

    @TempDir
    static Path tempDir;

    static FileContentExtractor extractor;

    @BeforeAll
    static void setUp() {
        extractor = new FileContentExtractor(ApplicationConfig.fromYaml("""
                similarity:
                  extraction:
                    max-content-length: -1
                """));
    }

    static Stream<Arguments> fileFormatProvider() {
        return Stream.of(
                Arguments.of("txt", (TestDocumentGenerator.FileGenerator) TestDocumentGenerator::createTxtFile, "text/plain"),
                Arguments.of("pdf", (TestDocumentGenerator.FileGenerator) TestDocumentGenerator::createPdfFile, "application/pdf"),
                Arguments.of("docx", (TestDocumentGenerator.FileGenerator) TestDocumentGenerator::createDocxFile,
                        "application/vnd.openxmlformats-officedocument.wordprocessingml.document")
        );
    }

    @ParameterizedTest(name = "{0} file extraction")
    @MethodSource("fileFormatProvider")
    @DisplayName("Should extract content from")
    void shouldExtractContentFromFile(final String extension,
                                      final TestDocumentGenerator.FileGenerator generator,
                                      final String expectedMimeType) throws Exception {
        // Given
        final Path testFile = tempDir.resolve("sample." + extension);
        generator.generate(testFile);

        // When
        final ExtractedDocument extracted = extractor.extract(testFile);

        // Then
        assertThat(extracted.fileName()).isEqualTo("sample." + extension);
        assertThat(extracted.fileSize()).isEqualTo(Files.size(testFile));
        assertThat(extracted.fileType())
                .as("Detected type for %s", extension)
                .startsWith(expectedMimeType);
        for (final String sentence : TestDocumentGenerator.TEST_SENTENCES) {
            assertThat(extracted.content())
                    .as("Extracted %s content", extension)
                    .contains(sentence);
        }
    }

    @ParameterizedTest(name = "{0} sentences")
    @MethodSource("fileFormatProvider")
    @DisplayName("Should split extracted content into the original sentences")
    void shouldSplitExtractedContent(final String extension,
                                     final TestDocumentGenerator.FileGenerator generator,
                                     final String expectedMimeType) throws Exception {
        final Path testFile = tempDir.resolve("split." + extension);
        generator.generate(testFile);

        final List<String> sentences = SentenceSplitter.split(extractor.extract(testFile).content());

        assertThat(sentences).containsExactlyElementsOf(TestDocumentGenerator.TEST_SENTENCES);
    }

    @Test
    void shouldRejectCorruptPdf() throws IOException {
        final Path broken = tempDir.resolve("broken.pdf");
        Files.writeString(broken, "%PDF-1.4\nthis is not really a pdf\n", StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> extractor.extract(broken)).isInstanceOf(IOException.class);
    }

    @Test
    void shouldTruncateAtConfiguredContentLength() throws IOException {
        final FileContentExtractor limited = new FileContentExtractor(ApplicationConfig.fromYaml("""
                similarity:
                  extraction:
                    max-content-length: 20
                """));
        final Path file = tempDir.resolve("long.txt");
        Files.writeString(file, "word ".repeat(200), StandardCharsets.UTF_8);

        final ExtractedDocument extracted = limited.extract(file);

        assertThat(extracted.content().length()).isLessThanOrEqualTo(20);
        assertThat(extracted.content()).startsWith("word word");
    }

    @Test
    void shouldApplyCompatibilityNormalization() {
        assertThat(FileContentExtractor.normalizeContent("\uFB01nance")).isEqualTo("finance");
    }

    @Test
    void shouldRemoveControlCharactersAndMapUnicodeSpaces() {
        assertThat(FileContentExtractor.normalizeContent("a\u0001b\u00A0c\u2003d\uFEFF")).isEqualTo("ab c d");
    }

    @Test
    void shouldCollapseWhitespaceButKeepLineBreaks() {
        assertThat(FileContentExtractor.normalizeContent("  First line.\t \r\n\r\n\n  Second   line.  "))
                .isEqualTo("First line.\nSecond line.");
    }

    @Test
    void shouldReturnEmptyStringForMissingContent() {
        assertThat(FileContentExtractor.normalizeContent(null)).isEmpty();
        assertThat(FileContentExtractor.normalizeContent("")).isEmpty();
        assertThat(FileContentExtractor.normalizeContent(" \n\t ")).isEmpty();
    }
}
