package de.mirkosertic.mcp.docsimilarity;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.docsimilarity.concurrent.AnalysisExecutorService;
import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import de.mirkosertic.mcp.docsimilarity.config.BuildInfo;
import de.mirkosertic.mcp.docsimilarity.config.LoggingConfigurator;
import de.mirkosertic.mcp.docsimilarity.mcp.SimilarityTools;
import de.mirkosertic.mcp.docsimilarity.service.SimilarityAnalysisService;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the MCP Document Similarity Server.
 * Wires the analysis services and serves the similarity tools over STDIO.
 */
public class DocSimilarityApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocSimilarityApplication.class);

    private final AnalysisExecutorService analysisExecutor;
    private final SimilarityTools similarityTools;
    private McpSyncServer mcpServer;

    public DocSimilarityApplication(final ApplicationConfig config) {
        this.analysisExecutor = new AnalysisExecutorService(config.getThreadPoolSize());
        final SimilarityAnalysisService analysisService = new SimilarityAnalysisService(config, analysisExecutor);
        this.similarityTools = new SimilarityTools(analysisService, config);
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                SimilarityTools.SERVER_NAME,
                BuildInfo.current().version()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(similarityTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Document Similarity Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            analysisExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down analysis executor", e);
        }

        logger.info("MCP Document Similarity Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first: in deployed mode nothing may reach stdout
            final String profile = System.getProperty("spring.profiles.active", System.getProperty("profile", "default"));
            final boolean deployedMode = "deployed".equalsIgnoreCase(profile);
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (logging to stderr)");
            }
            logger.info("MCP Document Similarity Server {} (built {})",
                    BuildInfo.current().version(), BuildInfo.current().buildTimestamp());

            final DocSimilarityApplication app = new DocSimilarityApplication(config);
            app.start();

        } catch (final Exception e) {
            System.err.println("Failed to start MCP Document Similarity Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
