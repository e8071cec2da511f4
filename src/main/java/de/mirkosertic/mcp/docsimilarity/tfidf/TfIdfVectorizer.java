package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Combines term frequencies and IDF weights into TF-IDF vectors.
 *
 * <ul>
 *   <li>{@link #dense(Map, InverseDocumentFrequency, Vocabulary)} produces a fixed-length
 *       vector in vocabulary order, used for the whole-document matrix.</li>
 *   <li>{@link #sparse(Map, InverseDocumentFrequency)} produces a term to weight map limited to
 *       the terms of the input, used for sentence matching. Absent terms weigh zero.</li>
 * </ul>
 */
public final class TfIdfVectorizer {

    private TfIdfVectorizer() {
        // Utility class, no instances
    }

    /**
     * @return vector of {@code vocabulary.size()} entries, {@code tf(term_i) * idf(term_i)} at
     *         position {@code i}, 0.0 where the term is missing from either map
     */
    public static double[] dense(final Map<String, Double> termFrequencies,
                                 final InverseDocumentFrequency idf,
                                 final Vocabulary vocabulary) {
        final double[] vector = new double[vocabulary.size()];
        for (int i = 0; i < vector.length; i++) {
            final String term = vocabulary.term(i);
            final Double tf = termFrequencies.get(term);
            if (tf != null) {
                vector[i] = tf * idf.weight(term);
            }
        }
        return vector;
    }

    /**
     * @return unmodifiable term to {@code tf * idf} map over the keys of {@code termFrequencies},
     *         iterating in term order
     */
    public static SortedMap<String, Double> sparse(final Map<String, Double> termFrequencies,
                                                   final InverseDocumentFrequency idf) {
        if (termFrequencies.isEmpty()) {
            return Collections.emptySortedMap();
        }
        final SortedMap<String, Double> vector = new TreeMap<>();
        for (final Map.Entry<String, Double> entry : termFrequencies.entrySet()) {
            vector.put(entry.getKey(), entry.getValue() * idf.weight(entry.getKey()));
        }
        return Collections.unmodifiableSortedMap(vector);
    }
}
