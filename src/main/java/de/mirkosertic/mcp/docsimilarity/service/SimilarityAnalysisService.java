package de.mirkosertic.mcp.docsimilarity.service;

import de.mirkosertic.mcp.docsimilarity.concurrent.AnalysisExecutorService;
import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import de.mirkosertic.mcp.docsimilarity.extraction.DocumentType;
import de.mirkosertic.mcp.docsimilarity.extraction.ExtractedDocument;
import de.mirkosertic.mcp.docsimilarity.extraction.FileContentExtractor;
import de.mirkosertic.mcp.docsimilarity.extraction.SentenceSplitter;
import de.mirkosertic.mcp.docsimilarity.tfidf.DocumentSimilarityPipeline;
import de.mirkosertic.mcp.docsimilarity.tfidf.SentenceAnalysisResult;
import de.mirkosertic.mcp.docsimilarity.tfidf.SentenceDocument;
import de.mirkosertic.mcp.docsimilarity.tfidf.SentenceSimilarityPipeline;
import de.mirkosertic.mcp.docsimilarity.tfidf.SimilarityMatrix;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates analysis requests against the configured limits and runs them through
 * extraction, sentence splitting and the TF-IDF pipelines.
 */
public class SimilarityAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityAnalysisService.class);

    private final ApplicationConfig config;
    private final DocumentSimilarityPipeline documentPipeline;
    private final SentenceSimilarityPipeline sentencePipeline;
    private final FileContentExtractor extractor;

    public SimilarityAnalysisService(final ApplicationConfig config, final AnalysisExecutorService executor) {
        this(config,
                new DocumentSimilarityPipeline(executor),
                new SentenceSimilarityPipeline(executor),
                new FileContentExtractor(config));
    }

    public SimilarityAnalysisService(final ApplicationConfig config,
                                     final DocumentSimilarityPipeline documentPipeline,
                                     final SentenceSimilarityPipeline sentencePipeline,
                                     final FileContentExtractor extractor) {
        this.config = config;
        this.documentPipeline = documentPipeline;
        this.sentencePipeline = sentencePipeline;
        this.extractor = extractor;
    }

    /**
     * Whole-document analysis. The matrix rows are labelled {@code doc0}, {@code doc1}, ...
     */
    public DocumentAnalysis analyzeDocuments(final List<String> documents) throws AnalysisRequestException {
        validateDocumentCount(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            validateDocumentText(documents.get(i), "Document at index " + i);
        }

        final long startTime = System.currentTimeMillis();
        final SimilarityMatrix matrix = documentPipeline.analyze(documents);
        final long elapsed = System.currentTimeMillis() - startTime;

        logger.info("Analyzed {} documents in {}ms", documents.size(), elapsed);
        return new DocumentAnalysis(matrix, elapsed);
    }

    /**
     * Sentence-level analysis of texts passed in directly.
     *
     * @param threshold minimum match similarity; {@code null} selects the configured default
     */
    public SentenceAnalysis analyzeTexts(final List<LabeledText> texts, final @Nullable Double threshold)
            throws AnalysisRequestException {
        final double effectiveThreshold = effectiveThreshold(threshold);
        validateDocumentCount(texts.size());

        final long startTime = System.currentTimeMillis();
        final List<SentenceDocument> documents = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            final LabeledText text = texts.get(i);
            final String label = text.label() == null || text.label().isBlank() ? "doc" + i : text.label();
            validateDocumentText(text.text(), "Document '" + label + "'");
            documents.add(toSentenceDocument(label, text.text()));
        }

        return runSentenceAnalysis(documents, effectiveThreshold, startTime);
    }

    /**
     * Sentence-level analysis of PDF, DOCX and TXT files. Each document is labelled with its file name.
     *
     * @param threshold minimum match similarity; {@code null} selects the configured default
     */
    public SentenceAnalysis analyzeFiles(final List<Path> files, final @Nullable Double threshold)
            throws AnalysisRequestException {
        final double effectiveThreshold = effectiveThreshold(threshold);
        validateFiles(files);

        final long startTime = System.currentTimeMillis();
        final List<SentenceDocument> documents = new ArrayList<>(files.size());
        for (final Path file : files) {
            final ExtractedDocument extracted = extract(file);
            documents.add(toSentenceDocument(extracted.fileName(), extracted.content()));
        }

        return runSentenceAnalysis(documents, effectiveThreshold, startTime);
    }

    private SentenceAnalysis runSentenceAnalysis(final List<SentenceDocument> documents,
                                                 final double threshold,
                                                 final long startTime) {
        int totalSentences = 0;
        for (final SentenceDocument document : documents) {
            totalSentences += document.sentenceCount();
        }

        final SentenceAnalysisResult result = sentencePipeline.analyze(documents, threshold);
        final long elapsed = System.currentTimeMillis() - startTime;

        logger.info("Sentence analysis of {} documents ({} sentences) in {}ms: {} matches at threshold {}",
                documents.size(), totalSentences, elapsed, result.matches().size(), threshold);

        return new SentenceAnalysis(
                new AnalysisMetadata(documents.size(), totalSentences, elapsed, threshold),
                result);
    }

    private static SentenceDocument toSentenceDocument(final String label, final String text)
            throws AnalysisRequestException {
        final List<String> sentences = SentenceSplitter.split(text);
        if (sentences.isEmpty()) {
            throw new AnalysisRequestException(ErrorCode.EMPTY_DOCUMENT,
                    "Document '" + label + "' contains no sentences");
        }
        return new SentenceDocument(label, sentences);
    }

    private ExtractedDocument extract(final Path file) throws AnalysisRequestException {
        try {
            return extractor.extract(file);
        } catch (final IOException e) {
            logger.warn("Text extraction failed for {}", file, e);
            throw new AnalysisRequestException(ErrorCode.EXTRACTION_FAILED,
                    "Failed to extract text from '" + file.getFileName() + "': " + e.getMessage(), e);
        }
    }

    double effectiveThreshold(final @Nullable Double threshold) throws AnalysisRequestException {
        if (threshold == null) {
            return config.getDefaultThreshold();
        }
        if (threshold.isNaN() || threshold < 0.0 || threshold > 1.0) {
            throw new AnalysisRequestException(ErrorCode.INVALID_THRESHOLD,
                    "Threshold must be between 0.0 and 1.0, got " + threshold);
        }
        return threshold;
    }

    private void validateDocumentCount(final int count) throws AnalysisRequestException {
        if (count == 0) {
            throw new AnalysisRequestException(ErrorCode.NO_DOCUMENTS, "No documents provided");
        }
        if (count < config.getMinDocuments()) {
            throw new AnalysisRequestException(ErrorCode.NOT_ENOUGH_DOCUMENTS,
                    "At least " + config.getMinDocuments() + " documents are required, got " + count);
        }
        if (count > config.getMaxDocuments()) {
            throw new AnalysisRequestException(ErrorCode.TOO_MANY_DOCUMENTS,
                    "At most " + config.getMaxDocuments() + " documents are allowed, got " + count);
        }
    }

    private void validateDocumentText(final @Nullable String text, final String description)
            throws AnalysisRequestException {
        if (text == null || text.isBlank()) {
            throw new AnalysisRequestException(ErrorCode.EMPTY_DOCUMENT, description + " is empty");
        }
        if (text.length() > config.getMaxDocumentLength()) {
            throw new AnalysisRequestException(ErrorCode.DOCUMENT_TOO_LONG,
                    description + " exceeds the maximum length of " + config.getMaxDocumentLength() + " characters");
        }
    }

    private void validateFiles(final List<Path> files) throws AnalysisRequestException {
        if (files.size() < config.getMinFiles()) {
            throw new AnalysisRequestException(ErrorCode.NOT_ENOUGH_FILES,
                    "Not enough files. Minimum required: " + config.getMinFiles());
        }
        if (files.size() > config.getMaxFiles()) {
            throw new AnalysisRequestException(ErrorCode.TOO_MANY_FILES,
                    "Too many files. Maximum allowed: " + config.getMaxFiles());
        }

        long totalSize = 0;
        for (final Path file : files) {
            if (!Files.isRegularFile(file)) {
                throw new AnalysisRequestException(ErrorCode.FILE_NOT_FOUND, "File not found: " + file);
            }
            final String fileName = file.getFileName().toString();
            if (DocumentType.fromFileName(fileName).isEmpty()) {
                throw new AnalysisRequestException(ErrorCode.UNSUPPORTED_FILE_TYPE,
                        "Unsupported file type: '" + fileName + "'. Supported types: PDF, DOCX, TXT");
            }

            final long size;
            try {
                size = Files.size(file);
            } catch (final IOException e) {
                throw new AnalysisRequestException(ErrorCode.FILE_NOT_FOUND,
                        "Cannot read file '" + fileName + "': " + e.getMessage(), e);
            }
            if (size > config.getMaxFileSize()) {
                throw new AnalysisRequestException(ErrorCode.FILE_TOO_LARGE,
                        "File '" + fileName + "' exceeds maximum size of " + config.getMaxFileSize() + " bytes");
            }
            totalSize += size;
        }

        if (totalSize > config.getMaxTotalSize()) {
            throw new AnalysisRequestException(ErrorCode.TOTAL_SIZE_TOO_LARGE,
                    "Total upload size exceeds maximum of " + config.getMaxTotalSize() + " bytes");
        }
    }
}
