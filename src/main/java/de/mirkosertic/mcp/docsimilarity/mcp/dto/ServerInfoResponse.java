package de.mirkosertic.mcp.docsimilarity.mcp.dto;

import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import de.mirkosertic.mcp.docsimilarity.config.BuildInfo;
import de.mirkosertic.mcp.docsimilarity.mcp.ToolResponse;

/**
 * Response DTO for the getServerInfo tool.
 */
public record ServerInfoResponse(
        boolean success,
        String name,
        String version,
        String buildTimestamp,
        int threadPoolSize,
        double defaultThreshold,
        Limits limits
) implements ToolResponse {

    public record Limits(
            int minDocuments,
            int maxDocuments,
            int maxDocumentLength,
            int minFiles,
            int maxFiles,
            long maxFileSize,
            long maxTotalSize
    ) {
    }

    public static ServerInfoResponse of(final String name, final BuildInfo buildInfo, final ApplicationConfig config) {
        return new ServerInfoResponse(true,
                name,
                buildInfo.version(),
                buildInfo.buildTimestamp(),
                config.getThreadPoolSize(),
                config.getDefaultThreshold(),
                new Limits(
                        config.getMinDocuments(),
                        config.getMaxDocuments(),
                        config.getMaxDocumentLength(),
                        config.getMinFiles(),
                        config.getMaxFiles(),
                        config.getMaxFileSize(),
                        config.getMaxTotalSize()));
    }
}
