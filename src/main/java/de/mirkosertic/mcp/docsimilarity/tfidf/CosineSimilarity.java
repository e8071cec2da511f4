package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.Map;

/**
 * Cosine similarity {@code dot(A, B) / (|A| * |B|)} over dense vectors and sparse term maps.
 *
 * <p>Both forms are total: mismatched or empty dense vectors and zero-magnitude inputs give
 * {@code 0.0} instead of an error or {@code NaN}. TF-IDF weights are non-negative, so results
 * fall into [0, 1].</p>
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
        // Utility class, no instances
    }

    public static double dense(final double[] vectorA, final double[] vectorB) {
        if (vectorA.length != vectorB.length || vectorA.length == 0) {
            return 0.0;
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < vectorA.length; i++) {
            dotProduct += vectorA[i] * vectorB[i];
            normA += vectorA[i] * vectorA[i];
            normB += vectorB[i] * vectorB[i];
        }

        return divide(dotProduct, Math.sqrt(normA), Math.sqrt(normB));
    }

    /**
     * Sparse form. The dot product runs over the keys of {@code vectorA} that are also present
     * in {@code vectorB}; each magnitude runs over its own map. With sorted maps every sum is
     * accumulated in term order.
     */
    public static double sparse(final Map<String, Double> vectorA, final Map<String, Double> vectorB) {
        if (vectorA.isEmpty() || vectorB.isEmpty()) {
            return 0.0;
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        for (final Map.Entry<String, Double> entry : vectorA.entrySet()) {
            final double a = entry.getValue();
            final Double b = vectorB.get(entry.getKey());
            if (b != null) {
                dotProduct += a * b;
            }
            normA += a * a;
        }

        double normB = 0.0;
        for (final double b : vectorB.values()) {
            normB += b * b;
        }

        return divide(dotProduct, Math.sqrt(normA), Math.sqrt(normB));
    }

    private static double divide(final double dotProduct, final double magnitudeA, final double magnitudeB) {
        if (magnitudeA == 0.0 || magnitudeB == 0.0) {
            return 0.0;
        }
        return dotProduct / (magnitudeA * magnitudeB);
    }
}
