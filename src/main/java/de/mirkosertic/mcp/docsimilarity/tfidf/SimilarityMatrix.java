package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * NxN document similarity matrix with one label per row, in input order.
 * {@code similarity(i, j)} is the cosine similarity of documents {@code i} and {@code j};
 * the diagonal is exactly 1.0.
 */
public final class SimilarityMatrix {

    private static final SimilarityMatrix EMPTY = new SimilarityMatrix(List.of(), new double[0][]);

    private final List<String> labels;
    private final double[][] values;

    public SimilarityMatrix(final List<String> labels, final double[][] values) {
        if (labels.size() != values.length) {
            throw new IllegalArgumentException("Expected " + labels.size() + " rows, got " + values.length);
        }
        this.labels = List.copyOf(labels);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != values.length) {
                throw new IllegalArgumentException("Row " + i + " has " + values[i].length
                        + " columns, expected " + values.length);
            }
            this.values[i] = values[i].clone();
        }
    }

    public static SimilarityMatrix empty() {
        return EMPTY;
    }

    public int size() {
        return labels.size();
    }

    boolean isEmpty() {
        return labels.isEmpty();
    }

    public List<String> labels() {
        return labels;
    }

    public double similarity(final int row, final int column) {
        return values[row][column];
    }

    double[] row(final int row) {
        return values[row].clone();
    }

    /**
     * @return the matrix as nested lists, suitable for JSON serialization
     */
    public List<List<Double>> toRows() {
        final List<List<Double>> rows = new ArrayList<>(values.length);
        for (final double[] row : values) {
            final List<Double> cells = new ArrayList<>(row.length);
            for (final double value : row) {
                cells.add(value);
            }
            rows.add(List.copyOf(cells));
        }
        return List.copyOf(rows);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimilarityMatrix other)) {
            return false;
        }
        return labels.equals(other.labels) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * labels.hashCode() + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "SimilarityMatrix{labels=" + labels + ", values=" + Arrays.deepToString(values) + "}";
    }
}
