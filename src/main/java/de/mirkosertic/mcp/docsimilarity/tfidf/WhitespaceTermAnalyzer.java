package de.mirkosertic.mcp.docsimilarity.tfidf;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.util.CharTokenizer;
import org.apache.lucene.util.AttributeFactory;

/**
 * Analyzer that splits already normalized text on whitespace and applies no further filtering.
 *
 * <p>Case folding and punctuation handling happen in {@link TextNormalizer} before the text
 * reaches this analyzer, so the token chain is a bare tokenizer that separates on
 * {@link TextNormalizer#isWhitespace(int)}. The maximum token length is raised to the Lucene
 * limit so that long tokens are not split.</p>
 */
public final class WhitespaceTermAnalyzer extends Analyzer {

    static final int MAX_TOKEN_LENGTH = StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT;

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        return new TokenStreamComponents(new UnicodeWhitespaceTokenizer());
    }

    private static final class UnicodeWhitespaceTokenizer extends CharTokenizer {

        UnicodeWhitespaceTokenizer() {
            super(AttributeFactory.DEFAULT_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH);
        }

        @Override
        protected boolean isTokenChar(final int c) {
            return !TextNormalizer.isWhitespace(c);
        }
    }
}
