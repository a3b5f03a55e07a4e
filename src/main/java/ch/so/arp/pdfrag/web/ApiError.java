package ch.so.arp.pdfrag.web;

import java.time.Instant;

/**
 * Error body returned by the REST API.
 *
 * @param errorId   unique id logged together with the technical details
 * @param code      machine-readable error code
 * @param message   message that is safe to show to users
 * @param path      request path that failed
 * @param timestamp when the error occurred
 */
public record ApiError(String errorId, String code, String message, String path, Instant timestamp) {

    public static final String EXTRACTION_FAILED = "DOCUMENT_001";
    public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
    public static final String EMBEDDING_RATE_LIMITED = "EMBEDDING_002";
    public static final String GENERATION_UNAVAILABLE = "LLM_001";
    public static final String GENERATION_RATE_LIMITED = "LLM_002";
    public static final String DIMENSION_MISMATCH = "STORE_001";
    public static final String STORE_UNAVAILABLE = "STORE_002";
    public static final String CONFIGURATION_ERROR = "CONFIG_001";
    public static final String VALIDATION_ERROR = "VALIDATION_001";
    public static final String PAYLOAD_TOO_LARGE = "VALIDATION_002";
    public static final String INTERNAL_ERROR = "INTERNAL_001";
}
