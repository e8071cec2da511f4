package de.mirkosertic.mcp.docsimilarity.tfidf;

/**
 * Mean sentence similarity between two documents over every cross-document sentence pair.
 * {@code docA} precedes {@code docB} in the input.
 */
public record GlobalSimilarity(String docA, String docB, double score) {
}
