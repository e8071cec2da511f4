package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.mcp.ToolResponse;
import de.mirkosertic.mcp.docsimilarity.service.DocumentAnalysis;
import de.mirkosertic.mcp.docsimilarity.service.ErrorCode;

import java.util.List;

/**
 * Response DTO for the analyzeDocuments tool.
 */
public record AnalyzeDocumentsResponse(
        boolean success,
        List<List<Double>> similarityMatrix,
        List<String> index,
        Long processingTimeMs,
        String errorCode,
        String error
) implements ToolResponse {

    public static AnalyzeDocumentsResponse success(final DocumentAnalysis analysis) {
        return new AnalyzeDocumentsResponse(true,
                analysis.matrix().toRows(),
                analysis.matrix().labels(),
                analysis.processingTimeMs(),
                null,
                null);
    }

    public static AnalyzeDocumentsResponse error(final ErrorCode errorCode, final String errorMessage) {
        return new AnalyzeDocumentsResponse(false, null, null, null, errorCode.name(), errorMessage);
    }
}
