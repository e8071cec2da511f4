package de.mirkosertic.mcp.docsimilarity.service;

import de.mirkosertic.mcp.docsimilarity.tfidf.SimilarityMatrix;

public record DocumentAnalysis(SimilarityMatrix matrix, long processingTimeMs) {
}
