package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes relative term frequencies for a token sequence.
 *
 * <p>{@code tf(term) = occurrences(term) / tokens.size()}. The returned map iterates in term
 * order so that every downstream sum is accumulated in the same order on every run.</p>
 */
public final class TermFrequencyCalculator {

    private TermFrequencyCalculator() {
        // Utility class, no instances
    }

    /**
     * @param tokens tokens of one document or sentence
     * @return unmodifiable term to frequency map; empty for an empty token list
     */
    public static SortedMap<String, Double> compute(final List<String> tokens) {
        if (tokens.isEmpty()) {
            return Collections.emptySortedMap();
        }

        final Map<String, Integer> counts = new TreeMap<>();
        for (final String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }

        final double total = tokens.size();
        final SortedMap<String, Double> frequencies = new TreeMap<>();
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            frequencies.put(entry.getKey(), entry.getValue() / total);
        }
        return Collections.unmodifiableSortedMap(frequencies);
    }
}
