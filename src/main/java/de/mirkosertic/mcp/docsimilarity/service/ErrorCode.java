package de.mirkosertic.mcp.docsimilarity.service;

/**
 * Machine-readable reason a request was rejected. Reported verbatim as {@code errorCode}.
 */
public enum ErrorCode {
    NO_DOCUMENTS,
    NOT_ENOUGH_DOCUMENTS,
    TOO_MANY_DOCUMENTS,
    EMPTY_DOCUMENT,
    DOCUMENT_TOO_LONG,
    NOT_ENOUGH_FILES,
    TOO_MANY_FILES,
    FILE_TOO_LARGE,
    TOTAL_SIZE_TOO_LARGE,
    FILE_NOT_FOUND,
    UNSUPPORTED_FILE_TYPE,
    EXTRACTION_FAILED,
    INVALID_THRESHOLD,
    INTERNAL_ERROR
}
