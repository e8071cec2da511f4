package de.mirkosertic.mcp.docsimilarity.service;

import de.mirkosertic.mcp.docsimilarity.tfidf.SentenceAnalysisResult;

public record SentenceAnalysis(AnalysisMetadata metadata, SentenceAnalysisResult result) {
}
