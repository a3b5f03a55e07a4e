package ch.so.arp.pdfrag.exception;

/**
 * Upstream failure of the embedding provider (timeouts, rate limits, rejected
 * credentials, malformed responses). Callers may retry the whole request later.
 */
public class EmbeddingProviderException extends RagException {

    private final boolean rateLimited;

    public EmbeddingProviderException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public EmbeddingProviderException(String message, boolean rateLimited, Throwable cause) {
        super(message, rateLimited
                ? "The embedding service is busy. Please try again in a moment."
                : "The embedding service is temporarily unavailable. Please try again later.", cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
