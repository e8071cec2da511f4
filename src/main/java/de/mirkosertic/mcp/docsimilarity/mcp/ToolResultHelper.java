package de.mirkosertic.mcp.docsimilarity.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.docsimilarity.service.ErrorCode;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Wraps response DTOs as MCP tool results: the DTO serialized to JSON inside a single text content.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        try {
            return textResult(OBJECT_MAPPER.writeValueAsString(response), !response.success());
        } catch (final JsonProcessingException e) {
            return createErrorResult(ErrorCode.INTERNAL_ERROR, "JSON serialization error: " + e.getOriginalMessage());
        }
    }

    public static McpSchema.CallToolResult createErrorResult(final ErrorCode errorCode, final String errorMessage) {
        // Built as a tree so the message is escaped by Jackson
        final ObjectNode node = OBJECT_MAPPER.createObjectNode()
                .put("success", false)
                .put("errorCode", errorCode.name())
                .put("error", errorMessage);
        return textResult(node.toString(), true);
    }

    private static McpSchema.CallToolResult textResult(final String json, final boolean error) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(json)))
                .isError(error)
                .build();
    }
}
