package de.mirkosertic.mcp.docsimilarity.extraction;

/**
 * Text content of one file together with what the extractor learned about the file.
 *
 * @param fileName name of the file, used as the document label
 * @param content  cleaned text content, empty if the file contained no text
 * @param fileType MIME type detected by Tika
 * @param fileSize size of the file in bytes
 */
public record ExtractedDocument(
        String fileName,
        String content,
        String fileType,
        long fileSize
) {
}
