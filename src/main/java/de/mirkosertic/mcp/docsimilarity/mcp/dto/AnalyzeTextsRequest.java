package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.mcp.Description;
import de.mirkosertic.mcp.docsimilarity.service.LabeledText;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the analyzeTexts tool.
 */
public record AnalyzeTextsRequest(
        @Description("The texts to compare sentence by sentence. Between 2 and 100 entries.")
        List<TextInput> documents,

        @Nullable
        @Description("Minimum cosine similarity (0.0 to 1.0) for a sentence pair to be reported. Default is 0.70.")
        Double threshold
) {
    public record TextInput(
            @Nullable
            @Description("Name under which the text is reported. Defaults to doc<index>.")
            String label,

            @Description("The plain text. Sentences end at '.', '!' or '?' followed by whitespace.")
            String text
    ) {
    }

    public static AnalyzeTextsRequest fromMap(final Map<String, Object> args) {
        final List<TextInput> documents = new ArrayList<>();
        if (args.get("documents") instanceof List<?> rawDocuments) {
            for (final Object item : rawDocuments) {
                if (item instanceof Map<?, ?> document) {
                    documents.add(new TextInput(
                            document.get("label") instanceof String label ? label : null,
                            document.get("text") instanceof String text ? text : null));
                } else if (item instanceof String text) {
                    documents.add(new TextInput(null, text));
                }
            }
        }
        return new AnalyzeTextsRequest(
                documents,
                args.get("threshold") instanceof Number number ? number.doubleValue() : null
        );
    }

    public List<LabeledText> toLabeledTexts() {
        final List<LabeledText> texts = new ArrayList<>(documents.size());
        for (final TextInput document : documents) {
            texts.add(new LabeledText(document.label(), document.text()));
        }
        return texts;
    }
}
