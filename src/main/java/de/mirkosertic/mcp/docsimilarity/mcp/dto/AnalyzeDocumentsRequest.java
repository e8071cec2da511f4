package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.mcp.Description;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the analyzeDocuments tool.
 */
public record AnalyzeDocumentsRequest(
        @Description("The documents to compare, as plain text. Between 2 and 100 documents, each at most 50000 characters.")
        List<String> documents
) {
    public static AnalyzeDocumentsRequest fromMap(final Map<String, Object> args) {
        final List<String> documents = new ArrayList<>();
        if (args.get("documents") instanceof List<?> rawDocuments) {
            for (final Object item : rawDocuments) {
                // Non-string entries are kept as null and rejected as empty documents
                documents.add(item instanceof String text ? text : null);
            }
        }
        return new AnalyzeDocumentsRequest(documents);
    }
}
