package de.mirkosertic.mcp.docsimilarity.service;

public record AnalysisMetadata(
        int documentsCount,
        int totalSentences,
        long processingTimeMs,
        double threshold
) {
}
