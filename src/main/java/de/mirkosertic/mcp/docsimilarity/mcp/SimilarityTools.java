package de.mirkosertic.mcp.docsimilarity.mcp;

import de.mirkosertic.mcp.docsimilarity.config.ApplicationConfig;
import de.mirkosertic.mcp.docsimilarity.config.BuildInfo;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.AnalyzeDocumentsRequest;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.AnalyzeDocumentsResponse;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.AnalyzeFilesRequest;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.AnalyzeTextsRequest;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.SentenceAnalysisResponse;
import de.mirkosertic.mcp.docsimilarity.mcp.dto.ServerInfoResponse;
import de.mirkosertic.mcp.docsimilarity.service.AnalysisRequestException;
import de.mirkosertic.mcp.docsimilarity.service.DocumentAnalysis;
import de.mirkosertic.mcp.docsimilarity.service.ErrorCode;
import de.mirkosertic.mcp.docsimilarity.service.SentenceAnalysis;
import de.mirkosertic.mcp.docsimilarity.service.SimilarityAnalysisService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tool definitions and handlers for the similarity server.
 */
public class SimilarityTools {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityTools.class);

    public static final String SERVER_NAME = "MCP Document Similarity Server";

    private static final String ANALYZE_DOCUMENTS_DESCRIPTION = """
            Compare whole documents with TF-IDF cosine similarity. \
            Returns an NxN similarity matrix in input order; rows and columns are labelled doc0, doc1, ... \
            Values range from 0.0 (no shared terms) to 1.0 (same term distribution). \
            Text is lowercased and ASCII punctuation removed before comparison; there is no stemming and no stopword removal.""";

    private static final String ANALYZE_TEXTS_DESCRIPTION = """
            Find similar sentences across texts. Each text is split into sentences, \
            every sentence of one text is compared with every sentence of every other text, \
            and sentence pairs at or above the threshold are returned, highest similarity first. \
            Also returns a global similarity per text pair (mean over all of its sentence pairs). \
            Sentences of the same text are never compared with each other.""";

    private static final String ANALYZE_FILES_DESCRIPTION = """
            Like analyzeTexts, but reads the texts from PDF, DOCX or TXT files on the server's file system. \
            Each document is reported under its file name.""";

    private final SimilarityAnalysisService analysisService;
    private final ApplicationConfig config;

    public SimilarityTools(final SimilarityAnalysisService analysisService, final ApplicationConfig config) {
        this.analysisService = analysisService;
        this.config = config;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("analyzeDocuments")
                        .description(ANALYZE_DOCUMENTS_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(AnalyzeDocumentsRequest.class))
                        .build())
                .callHandler((exchange, request) -> analyzeDocuments(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("analyzeTexts")
                        .description(ANALYZE_TEXTS_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(AnalyzeTextsRequest.class))
                        .build())
                .callHandler((exchange, request) -> analyzeTexts(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("analyzeFiles")
                        .description(ANALYZE_FILES_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(AnalyzeFilesRequest.class))
                        .build())
                .callHandler((exchange, request) -> analyzeFiles(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getServerInfo")
                        .description("Get server name, version and the active request limits.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getServerInfo())
                .build());

        return tools;
    }

    McpSchema.CallToolResult analyzeDocuments(final Map<String, Object> args) {
        final AnalyzeDocumentsRequest request = AnalyzeDocumentsRequest.fromMap(args);

        logger.info("Analyze documents request: {} documents", request.documents().size());

        try {
            final DocumentAnalysis analysis = analysisService.analyzeDocuments(request.documents());
            return ToolResultHelper.createResult(AnalyzeDocumentsResponse.success(analysis));
        } catch (final AnalysisRequestException e) {
            logger.warn("Analyze documents request rejected: {} {}", e.getErrorCode(), e.getMessage());
            return ToolResultHelper.createResult(AnalyzeDocumentsResponse.error(e.getErrorCode(), e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error analyzing documents", e);
            return ToolResultHelper.createResult(AnalyzeDocumentsResponse.error(ErrorCode.INTERNAL_ERROR,
                    "Error analyzing documents: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult analyzeTexts(final Map<String, Object> args) {
        final AnalyzeTextsRequest request = AnalyzeTextsRequest.fromMap(args);

        logger.info("Analyze texts request: {} texts, threshold={}", request.documents().size(), request.threshold());

        try {
            final SentenceAnalysis analysis = analysisService.analyzeTexts(request.toLabeledTexts(), request.threshold());
            return ToolResultHelper.createResult(SentenceAnalysisResponse.success(analysis));
        } catch (final AnalysisRequestException e) {
            logger.warn("Analyze texts request rejected: {} {}", e.getErrorCode(), e.getMessage());
            return ToolResultHelper.createResult(SentenceAnalysisResponse.error(e.getErrorCode(), e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error analyzing texts", e);
            return ToolResultHelper.createResult(SentenceAnalysisResponse.error(ErrorCode.INTERNAL_ERROR,
                    "Error analyzing texts: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult analyzeFiles(final Map<String, Object> args) {
        final AnalyzeFilesRequest request = AnalyzeFilesRequest.fromMap(args);

        logger.info("Analyze files request: paths={}, threshold={}", request.paths(), request.threshold());

        try {
            final SentenceAnalysis analysis = analysisService.analyzeFiles(request.toPaths(), request.threshold());
            return ToolResultHelper.createResult(SentenceAnalysisResponse.success(analysis));
        } catch (final AnalysisRequestException e) {
            logger.warn("Analyze files request rejected: {} {}", e.getErrorCode(), e.getMessage());
            return ToolResultHelper.createResult(SentenceAnalysisResponse.error(e.getErrorCode(), e.getMessage()));
        } catch (final InvalidPathException e) {
            logger.warn("Analyze files request rejected: invalid path {}", e.getInput());
            return ToolResultHelper.createResult(SentenceAnalysisResponse.error(ErrorCode.FILE_NOT_FOUND,
                    "Invalid path: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error analyzing files", e);
            return ToolResultHelper.createResult(SentenceAnalysisResponse.error(ErrorCode.INTERNAL_ERROR,
                    "Error analyzing files: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getServerInfo() {
        logger.info("Server info request");
        return ToolResultHelper.createResult(ServerInfoResponse.of(SERVER_NAME, BuildInfo.current(), config));
    }
}
