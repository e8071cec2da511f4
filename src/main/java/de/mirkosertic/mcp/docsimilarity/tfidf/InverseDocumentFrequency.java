package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Smoothed inverse document frequency weights of one corpus.
 *
 * <p>A corpus member is either a whole document or a single sentence, depending on the
 * pipeline. For every term present in at least one member:</p>
 * <pre>
 *   idf(term) = ln((N + 1) / (df + 1)) + 1
 * </pre>
 * <p>where {@code N} is the number of members and {@code df} the number of members whose
 * term frequency map contains the term. Every weight is therefore greater than zero.</p>
 *
 * <p>Instances are immutable and are shared read-only by all vectorization workers.</p>
 */
public final class InverseDocumentFrequency {

    private static final InverseDocumentFrequency EMPTY = new InverseDocumentFrequency(0, new TreeMap<>());

    private final int corpusSize;
    private final SortedMap<String, Double> weights;

    private InverseDocumentFrequency(final int corpusSize, final SortedMap<String, Double> weights) {
        this.corpusSize = corpusSize;
        this.weights = Collections.unmodifiableSortedMap(weights);
    }

    /**
     * Compute the IDF weights over all members of a corpus. Must see every member's term
     * frequencies, so it runs after all per-member work has completed.
     *
     * @param termFrequencies one term frequency map per corpus member
     * @return the weights; empty for an empty corpus
     */
    public static InverseDocumentFrequency compute(final List<? extends Map<String, Double>> termFrequencies) {
        if (termFrequencies.isEmpty()) {
            return EMPTY;
        }

        final Map<String, Integer> documentFrequency = new TreeMap<>();
        for (final Map<String, Double> tf : termFrequencies) {
            for (final String term : tf.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        final double n = termFrequencies.size();
        final SortedMap<String, Double> weights = new TreeMap<>();
        for (final Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            weights.put(entry.getKey(), Math.log((n + 1.0) / (entry.getValue() + 1.0)) + 1.0);
        }
        return new InverseDocumentFrequency(termFrequencies.size(), weights);
    }

    /**
     * @return the weight of the term, or {@code 0.0} if the corpus never contained it
     */
    public double weight(final String term) {
        final Double weight = weights.get(term);
        return weight != null ? weight : 0.0;
    }

    boolean contains(final String term) {
        return weights.containsKey(term);
    }

    /**
     * @return all weights, iterating in term order
     */
    public SortedMap<String, Double> asMap() {
        return weights;
    }

    int corpusSize() {
        return corpusSize;
    }

    public int termCount() {
        return weights.size();
    }

    boolean isEmpty() {
        return weights.isEmpty();
    }
}
