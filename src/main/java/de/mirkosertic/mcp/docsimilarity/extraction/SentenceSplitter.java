package de.mirkosertic.mcp.docsimilarity.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into sentences at {@code .}, {@code !} or {@code ?} followed by whitespace or the
 * end of the text.
 *
 * <p>The punctuation mark stays with its sentence, sentences are trimmed and empty ones dropped.
 * Text after the last boundary becomes the final sentence even without closing punctuation.
 * Abbreviations such as {@code "Dr."} are treated as sentence ends.</p>
 */
public final class SentenceSplitter {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?](?:\\s+|\\z)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private SentenceSplitter() {
        // Utility class, no instances
    }

    public static List<String> split(final String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        final List<String> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_BOUNDARY.matcher(text);
        int lastEnd = 0;

        while (matcher.find()) {
            addIfNotBlank(sentences, text.substring(lastEnd, matcher.start() + 1));
            lastEnd = matcher.end();
        }

        if (lastEnd < text.length()) {
            addIfNotBlank(sentences, text.substring(lastEnd));
        }

        return List.copyOf(sentences);
    }

    private static void addIfNotBlank(final List<String> sentences, final String candidate) {
        final String sentence = candidate.strip();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
    }
}
