package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the analyzeFiles tool.
 */
public record AnalyzeFilesRequest(
        @Description("Paths of the files to compare (PDF, DOCX or TXT). Between 2 and 5 files, at most 10 MB each and 50 MB in total.")
        List<String> paths,

        @Nullable
        @Description("Minimum cosine similarity (0.0 to 1.0) for a sentence pair to be reported. Default is 0.70.")
        Double threshold
) {
    public static AnalyzeFilesRequest fromMap(final Map<String, Object> args) {
        final List<String> paths = new ArrayList<>();
        if (args.get("paths") instanceof List<?> rawPaths) {
            for (final Object item : rawPaths) {
                if (item instanceof String path && !path.isBlank()) {
                    paths.add(path);
                }
            }
        }
        return new AnalyzeFilesRequest(
                paths,
                args.get("threshold") instanceof Number number ? number.doubleValue() : null
        );
    }

    public List<Path> toPaths() {
        final List<Path> result = new ArrayList<>(paths.size());
        for (final String path : paths) {
            result.add(Paths.get(path));
        }
        return result;
    }
}
