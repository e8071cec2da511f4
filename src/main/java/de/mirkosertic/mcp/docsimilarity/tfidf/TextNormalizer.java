package de.mirkosertic.mcp.docsimilarity.tfidf;

/**
 * Normalizes raw text before tokenization.
 *
 * <p>Steps applied in order:</p>
 * <ol>
 *   <li>Every ASCII punctuation character ({@code !"#$%&'()*+,-./:;<=>?@[\]^_`{|}~})
 *       is replaced with a single space.</li>
 *   <li>ASCII letters are lowercased. Non-ASCII characters pass through unchanged,
 *       including their case.</li>
 *   <li>Runs of whitespace are collapsed to a single space, leading and trailing
 *       whitespace is removed. Whitespace is the Unicode {@code White_Space} set, so
 *       no-break spaces and {@code U+0085} separate tokens while the information
 *       separators {@code U+001C..U+001F} do not.</li>
 * </ol>
 *
 * <p>Normalizing an already normalized string returns it unchanged.</p>
 */
public final class TextNormalizer {

    private TextNormalizer() {
        // Utility class, no instances
    }

    /**
     * Normalize the given text.
     *
     * @param text the raw text; null is treated as empty
     * @return the normalized text, empty if the input contained no token characters
     */
    public static String normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        final StringBuilder result = new StringBuilder(text.length());
        boolean pendingSpace = false;

        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);

            if (isAsciiPunctuation(c) || isWhitespace(c)) {
                // Only emit the separator once the next token character shows up
                pendingSpace = result.length() > 0;
                continue;
            }

            if (pendingSpace) {
                result.append(' ');
                pendingSpace = false;
            }
            result.append(c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c);
        }

        return result.toString();
    }

    /**
     * Unicode {@code White_Space}: the space, line and paragraph separators plus
     * {@code U+0009..U+000D} and {@code U+0085}. Every member lies in the BMP.
     */
    public static boolean isWhitespace(final int c) {
        return Character.isSpaceChar(c) || (c >= '\t' && c <= '\r') || c == '\u0085';
    }

    static boolean isAsciiPunctuation(final char c) {
        return (c >= '!' && c <= '/')
                || (c >= ':' && c <= '@')
                || (c >= '[' && c <= '`')
                || (c >= '{' && c <= '~');
    }
}
