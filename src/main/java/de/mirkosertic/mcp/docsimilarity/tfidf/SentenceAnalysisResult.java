package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.List;

/**
 * Output of {@link SentenceSimilarityPipeline}. Both lists are sorted by score, highest first.
 */
public record SentenceAnalysisResult(List<SentenceMatch> matches, List<GlobalSimilarity> globalSimilarities) {

    private static final SentenceAnalysisResult EMPTY = new SentenceAnalysisResult(List.of(), List.of());

    public SentenceAnalysisResult {
        matches = List.copyOf(matches);
        globalSimilarities = List.copyOf(globalSimilarities);
    }

    public static SentenceAnalysisResult empty() {
        return EMPTY;
    }
}
