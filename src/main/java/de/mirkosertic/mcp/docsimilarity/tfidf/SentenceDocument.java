package de.mirkosertic.mcp.docsimilarity.tfidf;

import java.util.List;

/**
 * A document split into sentences. The position of a sentence in {@link #sentences()} is the
 * index reported in {@link SentenceMatch}.
 *
 * @param fileName  label of the document, usually the name of the uploaded file
 * @param sentences sentences in document order
 */
public record SentenceDocument(String fileName, List<String> sentences) {

    public SentenceDocument {
        sentences = List.copyOf(sentences);
    }

    public int sentenceCount() {
        return sentences.size();
    }
}
