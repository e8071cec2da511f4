package de.mirkosertic.mcp.docsimilarity.tfidf;

import de.mirkosertic.mcp.docsimilarity.concurrent.AnalysisExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;

/**
 * Sentence-level cross-document similarity analysis.
 *
 * <p>Every sentence of every document becomes one member of a single shared corpus, so the IDF
 * weights reflect term rarity across all input documents together, not per document.</p>
 *
 * <p>Stages:</p>
 * <ol>
 *   <li>Flatten all documents into (document index, sentence index, text) entries</li>
 *   <li>Normalize and tokenize every sentence (parallel)</li>
 *   <li>Term frequencies per sentence (parallel)</li>
 *   <li>IDF over all sentences of all documents (calling thread, waits for every TF map)</li>
 *   <li>Sparse TF-IDF map per sentence (parallel)</li>
 *   <li>For every document pair {@code a < b} (parallel by pair): the similarity of every
 *       sentence of {@code a} with every sentence of {@code b}. Pairs at or above the threshold
 *       become matches; the mean over all pairs becomes the global similarity.</li>
 * </ol>
 *
 * <p>Sentences of the same document are never compared with each other. A document pair in
 * which either side has no sentences is left out of the global similarities.</p>
 */
public class SentenceSimilarityPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SentenceSimilarityPipeline.class);

    /**
     * Score descending, then the order in which the pair appears in the flattened sentence list.
     */
    private static final Comparator<RankedMatch> MATCH_ORDER = Comparator
            .comparingDouble((RankedMatch ranked) -> ranked.match().similarity()).reversed()
            .thenComparingInt(RankedMatch::sourceDocIndex)
            .thenComparingInt(ranked -> ranked.match().sourceSentenceIndex())
            .thenComparingInt(RankedMatch::targetDocIndex)
            .thenComparingInt(ranked -> ranked.match().targetSentenceIndex());

    private final AnalysisExecutorService executor;

    public SentenceSimilarityPipeline(final AnalysisExecutorService executor) {
        this.executor = executor;
    }

    private record SentenceEntry(int documentIndex, int sentenceIndex, String text) {
    }

    private record DocumentPair(int docA, int docB) {
    }

    private record RankedMatch(int sourceDocIndex, int targetDocIndex, SentenceMatch match) {
    }

    private record PairResult(List<RankedMatch> matches, @Nullable GlobalSimilarity globalSimilarity) {
    }

    /**
     * @param documents documents in input order
     * @param threshold minimum similarity of a reported match, inclusive
     */
    public SentenceAnalysisResult analyze(final List<SentenceDocument> documents, final double threshold) {
        final List<SentenceEntry> entries = flatten(documents);
        if (entries.isEmpty()) {
            return SentenceAnalysisResult.empty();
        }

        final List<List<String>> tokenized = executor.map(entries,
                entry -> TermTokenizer.tokenize(TextNormalizer.normalize(entry.text())));

        final List<SortedMap<String, Double>> termFrequencies = executor.map(tokenized,
                TermFrequencyCalculator::compute);

        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(termFrequencies);

        logger.debug("Sentence corpus: {} sentences from {} documents, {} distinct terms",
                entries.size(), documents.size(), idf.termCount());

        final List<SortedMap<String, Double>> vectors = executor.map(termFrequencies,
                tf -> TfIdfVectorizer.sparse(tf, idf));

        final List<List<SortedMap<String, Double>>> vectorsByDocument = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            vectorsByDocument.add(new ArrayList<>(documents.get(i).sentenceCount()));
        }
        for (int i = 0; i < entries.size(); i++) {
            vectorsByDocument.get(entries.get(i).documentIndex()).add(vectors.get(i));
        }

        final List<DocumentPair> pairs = new ArrayList<>();
        for (int a = 0; a < documents.size(); a++) {
            for (int b = a + 1; b < documents.size(); b++) {
                pairs.add(new DocumentPair(a, b));
            }
        }

        final List<PairResult> pairResults = executor.map(pairs,
                pair -> comparePair(pair, documents, vectorsByDocument, threshold));

        final List<RankedMatch> rankedMatches = new ArrayList<>();
        final List<GlobalSimilarity> globalSimilarities = new ArrayList<>();
        for (final PairResult pairResult : pairResults) {
            rankedMatches.addAll(pairResult.matches());
            if (pairResult.globalSimilarity() != null) {
                globalSimilarities.add(pairResult.globalSimilarity());
            }
        }

        rankedMatches.sort(MATCH_ORDER);
        // Stable sort: equal scores keep the (docA, docB) order of the pair list
        globalSimilarities.sort(Comparator.comparingDouble(GlobalSimilarity::score).reversed());

        final List<SentenceMatch> matches = new ArrayList<>(rankedMatches.size());
        for (final RankedMatch rankedMatch : rankedMatches) {
            matches.add(rankedMatch.match());
        }

        logger.debug("Sentence analysis: {} matches at threshold {}, {} document pairs scored",
                matches.size(), threshold, globalSimilarities.size());

        return new SentenceAnalysisResult(matches, globalSimilarities);
    }

    private static List<SentenceEntry> flatten(final List<SentenceDocument> documents) {
        final List<SentenceEntry> entries = new ArrayList<>();
        for (int documentIndex = 0; documentIndex < documents.size(); documentIndex++) {
            final List<String> sentences = documents.get(documentIndex).sentences();
            for (int sentenceIndex = 0; sentenceIndex < sentences.size(); sentenceIndex++) {
                entries.add(new SentenceEntry(documentIndex, sentenceIndex, sentences.get(sentenceIndex)));
            }
        }
        return entries;
    }

    private static PairResult comparePair(final DocumentPair pair,
                                          final List<SentenceDocument> documents,
                                          final List<List<SortedMap<String, Double>>> vectorsByDocument,
                                          final double threshold) {
        final List<SortedMap<String, Double>> vectorsA = vectorsByDocument.get(pair.docA());
        final List<SortedMap<String, Double>> vectorsB = vectorsByDocument.get(pair.docB());
        if (vectorsA.isEmpty() || vectorsB.isEmpty()) {
            return new PairResult(List.of(), null);
        }

        final SentenceDocument documentA = documents.get(pair.docA());
        final SentenceDocument documentB = documents.get(pair.docB());

        final List<RankedMatch> matches = new ArrayList<>();
        double sum = 0.0;
        for (int sentenceA = 0; sentenceA < vectorsA.size(); sentenceA++) {
            for (int sentenceB = 0; sentenceB < vectorsB.size(); sentenceB++) {
                final double similarity = CosineSimilarity.sparse(vectorsA.get(sentenceA), vectorsB.get(sentenceB));
                sum += similarity;
                if (similarity >= threshold) {
                    matches.add(new RankedMatch(pair.docA(), pair.docB(), new SentenceMatch(
                            documentA.fileName(),
                            sentenceA,
                            documentA.sentences().get(sentenceA),
                            documentB.fileName(),
                            sentenceB,
                            documentB.sentences().get(sentenceB),
                            similarity
                    )));
                }
            }
        }

        final double score = sum / ((double) vectorsA.size() * vectorsB.size());
        return new PairResult(matches, new GlobalSimilarity(documentA.fileName(), documentB.fileName(), score));
    }
}
