package ch.so.arp.pdfrag.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import ch.so.arp.pdfrag.exception.ConfigurationException;
import ch.so.arp.pdfrag.exception.DimensionMismatchException;
import ch.so.arp.pdfrag.exception.EmbeddingProviderException;
import ch.so.arp.pdfrag.exception.ExtractionException;
import ch.so.arp.pdfrag.exception.StoreException;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/upload");

    @Test
    void namesTheFileThatCouldNotBeRead() {
        ResponseEntity<ApiError> response = handler.handleExtraction(
                new ExtractionException("plan.pdf", "the document is encrypted"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        ApiError error = response.getBody();
        assertThat(error.code()).isEqualTo(ApiError.EXTRACTION_FAILED);
        assertThat(error.message()).contains("plan.pdf");
        assertThat(error.path()).isEqualTo("/api/upload");
        assertThat(error.errorId()).hasSize(8);
        assertThat(error.timestamp()).isNotNull();
    }

    @Test
    void distinguishesRateLimitedProviders() {
        ResponseEntity<ApiError> limited = handler.handleEmbedding(
                new EmbeddingProviderException("HTTP 429", true, null), request);
        ResponseEntity<ApiError> failed = handler.handleEmbedding(
                new EmbeddingProviderException("HTTP 500", false, null), request);

        assertThat(limited.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(limited.getBody().code()).isEqualTo(ApiError.EMBEDDING_RATE_LIMITED);
        assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(failed.getBody().code()).isEqualTo(ApiError.EMBEDDING_UNAVAILABLE);
    }

    @Test
    void hidesTechnicalDetailsOfStoreFailures() {
        StoreException failure = new StoreException("Connection to localhost:5432 refused",
                new IllegalStateException("refused"));

        ResponseEntity<ApiError> response = handler.handleStore(failure, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo(failure.getUserMessage()).doesNotContain("5432");
    }

    @Test
    void reportsDimensionDriftAndMisconfigurationAsServerErrors() {
        assertThat(handler.handleDimensionMismatch(new DimensionMismatchException(1536, 768), request)
                .getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(handler.handleConfiguration(new ConfigurationException("missing key"), request)
                .getBody().code()).isEqualTo(ApiError.CONFIGURATION_ERROR);
    }

    @Test
    void rejectsOversizedUploads() {
        ResponseEntity<ApiError> response = handler.handleUploadTooLarge(
                new MaxUploadSizeExceededException(20 * 1024 * 1024), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @Test
    void coversUnexpectedErrors() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("bug"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).doesNotContain("bug");
    }
}
