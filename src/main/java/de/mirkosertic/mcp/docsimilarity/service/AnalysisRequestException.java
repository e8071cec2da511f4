package de.mirkosertic.mcp.docsimilarity.service;

/**
 * Thrown when a request violates one of the input limits or cannot be read.
 */
public class AnalysisRequestException extends Exception {

    private final ErrorCode errorCode;

    public AnalysisRequestException(final ErrorCode errorCode, final String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalysisRequestException(final ErrorCode errorCode, final String message, final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
