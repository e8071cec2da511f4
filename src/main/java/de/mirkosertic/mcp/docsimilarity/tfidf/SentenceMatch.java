package de.mirkosertic.mcp.docsimilarity.tfidf;

/**
 * Two sentences from different documents whose similarity reached the match threshold.
 * The source side belongs to the document that came first in the input.
 */
public record SentenceMatch(
        String sourceDoc,
        int sourceSentenceIndex,
        String sourceSentence,
        String targetDoc,
        int targetSentenceIndex,
        String targetSentence,
        double similarity
) {
}
