package de.mirkosertic.mcp.docsimilarity.tfidf;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits normalized text into whitespace-delimited tokens, preserving their order.
 *
 * <p>Backed by a shared {@link WhitespaceTermAnalyzer}. Lucene analyzers keep their token
 * stream components per thread, so this class is safe to call from the analysis workers.</p>
 */
public final class TermTokenizer {

    private static final String FIELD_NAME = "content";

    private static final Analyzer ANALYZER = new WhitespaceTermAnalyzer();

    private TermTokenizer() {
        // Utility class, no instances
    }

    /**
     * Tokenize normalized text.
     *
     * @param normalizedText output of {@link TextNormalizer#normalize(String)}
     * @return the non-empty tokens in input order; empty for empty input
     */
    public static List<String> tokenize(final String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return List.of();
        }

        final List<String> tokens = new ArrayList<>();
        try (final TokenStream tokenStream = ANALYZER.tokenStream(FIELD_NAME, normalizedText)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                if (termAttr.length() > 0) {
                    tokens.add(termAttr.toString());
                }
            }
            tokenStream.end();
        } catch (final IOException e) {
            // Reading from an in-memory string does not fail
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return List.copyOf(tokens);
    }
}
