package ch.so.arp.pdfrag.openai;

import java.io.IOException;

/**
 * Failed call against the OpenAI REST API. {@code statusCode} is {@code 0} when no
 * HTTP response was received.
 */
public class OpenAiApiException extends IOException {

    private final int statusCode;

    public OpenAiApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
