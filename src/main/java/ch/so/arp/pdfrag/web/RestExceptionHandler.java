package ch.so.arp.pdfrag.web;

import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import ch.so.arp.pdfrag.exception.ConfigurationException;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;
import ch.so.arp.pdfrag.exception.EmbeddingProviderException;
import ch.so.arp.pdfrag.exception.ExtractionException;
import ch.so.arp.pdfrag.exception.GenerationProviderException;
import ch.so.arp.pdfrag.exception.StoreException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Translates pipeline failures into {@link ApiError} responses. Technical details
 * only go to the log, tagged with the error id that is returned to the caller.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ApiError> handleExtraction(ExtractionException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Extraction failed [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, errorId, ApiError.EXTRACTION_FAILED, ex.getUserMessage(),
                request);
    }

    @ExceptionHandler(EmbeddingProviderException.class)
    public ResponseEntity<ApiError> handleEmbedding(EmbeddingProviderException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        if (ex.isRateLimited()) {
            LOGGER.warn("Embedding provider rate limited [{}]: {}", errorId, ex.getMessage());
            return respond(HttpStatus.TOO_MANY_REQUESTS, errorId, ApiError.EMBEDDING_RATE_LIMITED,
                    ex.getUserMessage(), request);
        }
        LOGGER.error("Embedding provider failed [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.EMBEDDING_UNAVAILABLE, ex.getUserMessage(),
                request);
    }

    @ExceptionHandler(GenerationProviderException.class)
    public ResponseEntity<ApiError> handleGeneration(GenerationProviderException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        if (ex.isRateLimited()) {
            LOGGER.warn("Language model rate limited [{}]: {}", errorId, ex.getMessage());
            return respond(HttpStatus.TOO_MANY_REQUESTS, errorId, ApiError.GENERATION_RATE_LIMITED,
                    ex.getUserMessage(), request);
        }
        LOGGER.error("Language model failed [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.GENERATION_UNAVAILABLE,
                ex.getUserMessage(), request);
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ApiError> handleDimensionMismatch(DimensionMismatchException ex,
            HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Embedding dimension drift [{}]: expected {}, got {}", errorId, ex.getExpected(),
                ex.getActual(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.DIMENSION_MISMATCH, ex.getUserMessage(),
                request);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Configuration error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.CONFIGURATION_ERROR, ex.getUserMessage(),
                request);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiError> handleStore(StoreException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Vector store failure [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.STORE_UNAVAILABLE, ex.getUserMessage(),
                request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOGGER.warn("Validation failed [{}]: {}", errorId, message);
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MissingServletRequestPartException.class })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Malformed request [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "The request is malformed.",
                request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex,
            HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, errorId, ApiError.PAYLOAD_TOO_LARGE,
                "The uploaded file is too large.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String errorId, String code, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private static String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
