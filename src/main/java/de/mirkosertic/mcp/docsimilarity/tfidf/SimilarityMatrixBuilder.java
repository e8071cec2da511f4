package de.mirkosertic.mcp.docsimilarity.tfidf;

import de.mirkosertic.mcp.docsimilarity.concurrent.AnalysisExecutorService;

import java.util.List;

/**
 * Builds the full NxN similarity matrix from dense TF-IDF vectors, one row per worker task.
 * <p>
 * Diagonal cells are set to 1.0 directly rather than measured. Both triangles are computed;
 * {@link CosineSimilarity#dense(double[], double[])} is exactly commutative, so the result is
 * symmetric.
 */
public class SimilarityMatrixBuilder {

    private final AnalysisExecutorService executor;

    public SimilarityMatrixBuilder(final AnalysisExecutorService executor) {
        this.executor = executor;
    }

    public double[][] build(final List<double[]> vectors) {
        final int n = vectors.size();
        if (n == 0) {
            return new double[0][];
        }

        final List<double[]> rows = executor.mapRange(n, i -> {
            final double[] row = new double[n];
            final double[] vectorI = vectors.get(i);
            for (int j = 0; j < n; j++) {
                row[j] = i == j ? 1.0 : CosineSimilarity.dense(vectorI, vectors.get(j));
            }
            return row;
        });

        return rows.toArray(new double[0][]);
    }
}
