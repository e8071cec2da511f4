package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.List;

/**
 * Sorted, distinct terms of a corpus. Position {@code i} of every dense vector built against
 * the same vocabulary holds the weight of {@code terms().get(i)}.
 */
public record Vocabulary(List<String> terms) {

    public Vocabulary {
        terms = List.copyOf(terms);
    }

    /**
     * Build the vocabulary from the terms of an IDF map. The map iterates in term order, so
     * the resulting list is already sorted and free of duplicates.
     */
    public static Vocabulary of(final InverseDocumentFrequency idf) {
        return new Vocabulary(List.copyOf(idf.asMap().keySet()));
    }

    public int size() {
        return terms.size();
    }

    public String term(final int index) {
        return terms.get(index);
    }
}
