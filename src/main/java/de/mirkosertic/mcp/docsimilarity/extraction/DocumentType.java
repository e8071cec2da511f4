package de.mirkosertic.mcp.docsimilarity.extraction;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * File formats accepted for sentence-level analysis, detected from the file extension.
 */
public enum DocumentType {

    PDF("pdf"),
    DOCX("docx"),
    TXT("txt");

    private final String extension;

    DocumentType(final String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * @param fileName a file name such as {@code report.PDF}; the extension is matched case-insensitively
     * @return the type, or empty if the name has no supported extension
     */
    public static Optional<DocumentType> fromFileName(final @Nullable String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        final String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (final DocumentType type : values()) {
            if (type.extension.equals(extension)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
