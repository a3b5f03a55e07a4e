package ch.so.arp.pdfrag.exception;

/**
 * Base type of all failures raised by the ingestion and retrieval pipeline. Next
 * to the technical message that ends up in the server log every instance carries
 * a message that can be shown to end users as is.
 */
public abstract class RagException extends RuntimeException {

    private final String userMessage;

    protected RagException(String message, String userMessage) {
        super(message);
        this.userMessage = userMessage;
    }

    protected RagException(String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
