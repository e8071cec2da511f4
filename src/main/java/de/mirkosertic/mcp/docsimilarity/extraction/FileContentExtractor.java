package de.mirkosertic.mcp.docsimilarity.extraction;

import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Extracts plain text from PDF, DOCX and TXT files using Apache Tika.
 */
public class FileContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FileContentExtractor.class);

    // U+0000-U+0008, U+000B-U+000C, U+000E-U+001F, U+007F-U+009F; keeps \t, \n and \r
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    // NBSP, ogham space, en quad through zero width space, narrow NBSP, medium math space, ideographic space, BOM
    private static final Pattern UNICODE_SPACES = Pattern.compile("[\\u00A0\\u1680\\u2000-\\u200B\\u202F\\u205F\\u3000\\uFEFF]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\r ]+");
    private static final Pattern NEWLINE_RUNS = Pattern.compile(" *\\n[ \\n]*");

    private final long maxContentLength;
    private final Tika tika;
    private final Parser parser;

    public FileContentExtractor(final ApplicationConfig config) {
        this.maxContentLength = config.getMaxContentLength();
        this.tika = new Tika();
        this.parser = new AutoDetectParser();
    }

    public ExtractedDocument extract(final Path file) throws IOException {
        final long fileSize = Files.size(file);
        final String fileName = file.getFileName().toString();

        try (final InputStream stream = Files.newInputStream(file)) {
            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);

            // -1 means unlimited
            final BodyContentHandler handler = maxContentLength <= 0
                    ? new BodyContentHandler(-1)
                    : new BodyContentHandler((int) Math.min(Integer.MAX_VALUE, maxContentLength));

            final ParseContext context = new ParseContext();
            context.set(Parser.class, parser);

            try {
                parser.parse(stream, handler, metadata, context);
            } catch (final SAXException | TikaException e) {
                if (!WriteLimitReachedException.isWriteLimitReached(e)) {
                    logger.error("Error parsing file: {}", file, e);
                    throw new IOException("Failed to parse document " + fileName + ": " + e.getMessage(), e);
                }
                // The handler keeps everything up to the limit
                logger.debug("Content of {} truncated at {} characters", file, maxContentLength);
            }

            final String content = normalizeContent(handler.toString());
            logger.debug("Extracted {} characters from file: {}", content.length(), file);

            return new ExtractedDocument(fileName, content, tika.detect(file), fileSize);
        }
    }

    /**
     * Clean up extraction artifacts while keeping line structure:
     * NFKC normalization (ligatures, full-width forms), control character removal,
     * Unicode spaces mapped to ASCII space, runs of spaces and tabs collapsed, runs of blank
     * lines collapsed to a single newline, and a final trim.
     *
     * @param content raw content as returned by Tika; may be null
     * @return the cleaned string, empty if the input was null or empty
     */
    static String normalizeContent(final String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(content, Normalizer.Form.NFKC);
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = UNICODE_SPACES.matcher(result).replaceAll(" ");
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = NEWLINE_RUNS.matcher(result).replaceAll("\n");
        return result.strip();
    }
}
