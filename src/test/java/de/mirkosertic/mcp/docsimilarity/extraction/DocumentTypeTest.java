package de.mirkosertic.mcp.docsimilarity.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentTypeTest {

    @ParameterizedTest
    @CsvSource({
            "report.pdf, PDF",
            "REPORT.PDF, PDF",
            "letter.docx, DOCX",
            "Letter.DocX, DOCX",
            "notes.txt, TXT",
            "archive.v2.txt, TXT"
    })
    void shouldDetectSupportedExtensions(final String fileName, final DocumentType expected) {
        assertThat(DocumentType.fromFileName(fileName)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"image.png", "legacy.doc", "noextension", "trailingdot.", "pdf", ".hidden"})
    void shouldRejectUnsupportedNames(final String fileName) {
        assertThat(DocumentType.fromFileName(fileName)).isEmpty();
    }

    @Test
    void shouldRejectNullName() {
        assertThat(DocumentType.fromFileName(null)).isEmpty();
    }

    @Test
    void shouldExposeLowercaseExtension() {
        assertThat(DocumentType.PDF.extension()).isEqualTo("pdf");
        assertThat(DocumentType.DOCX.extension()).isEqualTo("docx");
        assertThat(DocumentType.TXT.extension()).isEqualTo("txt");
    }
}
