package de.mirkosertic.mcp.docsimilarity.tfidf;

import de.mirkosertic.mcp.docsimilarity.concurrent.AnalysisExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Whole-document similarity analysis.
 *
 * <p>Stages:</p>
 * <ol>
 *   <li>Normalize and tokenize every document (parallel)</li>
 *   <li>Term frequencies per document (parallel)</li>
 *   <li>IDF over all documents (calling thread, waits for every TF map)</li>
 *   <li>Sorted vocabulary from the IDF terms</li>
 *   <li>Dense TF-IDF vector per document against the shared vocabulary (parallel)</li>
 *   <li>Similarity matrix (parallel by row)</li>
 * </ol>
 *
 * <p>Documents are labelled {@code doc0}, {@code doc1}, ... in input order.</p>
 */
public class DocumentSimilarityPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSimilarityPipeline.class);

    private final AnalysisExecutorService executor;
    private final SimilarityMatrixBuilder matrixBuilder;

    public DocumentSimilarityPipeline(final AnalysisExecutorService executor) {
        this.executor = executor;
        this.matrixBuilder = new SimilarityMatrixBuilder(executor);
    }

    public SimilarityMatrix analyze(final List<String> documents) {
        if (documents.isEmpty()) {
            return SimilarityMatrix.empty();
        }

        final List<String> labels = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            labels.add("doc" + i);
        }

        final List<List<String>> tokenized = executor.map(documents,
                document -> TermTokenizer.tokenize(TextNormalizer.normalize(document)));

        final List<SortedMap<String, Double>> termFrequencies = executor.map(tokenized,
                TermFrequencyCalculator::compute);

        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(termFrequencies);
        final Vocabulary vocabulary = Vocabulary.of(idf);

        logger.debug("Document corpus: {} documents, vocabulary of {} terms", documents.size(), vocabulary.size());

        final List<double[]> vectors = executor.map(termFrequencies,
                tf -> TfIdfVectorizer.dense(tf, idf, vocabulary));

        return new SimilarityMatrix(labels, matrixBuilder.build(vectors));
    }
}
