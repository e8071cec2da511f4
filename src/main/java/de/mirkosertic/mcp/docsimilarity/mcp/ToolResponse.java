package de.mirkosertic.mcp.docsimilarity.mcp;

/**
 * Implemented by every tool response DTO. A response with {@code success() == false} is
 * reported with the MCP {@code isError} flag set.
 */
public interface ToolResponse {

    boolean success();
}
