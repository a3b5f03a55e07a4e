package ch.so.arp.pdfrag.exception;

/**
 * Upstream failure of the language model that generates answers. No retry is
 * attempted internally.
 */
public class GenerationProviderException extends RagException {

    private final boolean rateLimited;

    public GenerationProviderException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public GenerationProviderException(String message, boolean rateLimited, Throwable cause) {
        super(message, rateLimited
                ? "The answer service is busy. Please try again in a moment."
                : "The answer service is temporarily unavailable. Please try again later.", cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
