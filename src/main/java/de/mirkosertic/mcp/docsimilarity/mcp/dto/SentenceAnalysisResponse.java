package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.mcp.ToolResponse;
import de.mirkosertic.mcp.docsimilarity.service.AnalysisMetadata;
import de.mirkosertic.mcp.docsimilarity.service.ErrorCode;
import de.mirkosertic.mcp.docsimilarity.service.SentenceAnalysis;
import de.mirkosertic.mcp.docsimilarity.tfidf.GlobalSimilarity;
import de.mirkosertic.mcp.docsimilarity.tfidf.SentenceMatch;

import java.util.List;

/**
 * Response DTO for the analyzeTexts and analyzeFiles tools.
 */
public record SentenceAnalysisResponse(
        boolean success,
        AnalysisMetadata metadata,
        List<SentenceMatch> matches,
        List<GlobalSimilarity> globalSimilarity,
        String errorCode,
        String error
) implements ToolResponse {

    public static SentenceAnalysisResponse success(final SentenceAnalysis analysis) {
        return new SentenceAnalysisResponse(true,
                analysis.metadata(),
                analysis.result().matches(),
                analysis.result().globalSimilarities(),
                null,
                null);
    }

    public static SentenceAnalysisResponse error(final ErrorCode errorCode, final String errorMessage) {
        return new SentenceAnalysisResponse(false, null, null, null, errorCode.name(), errorMessage);
    }
}
