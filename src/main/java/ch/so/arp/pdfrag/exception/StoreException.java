package ch.so.arp.pdfrag.exception;

/**
 * Connectivity or constraint failure of the vector store. The user facing message
 * stays generic, details are only logged.
 */
public class StoreException extends RagException {

    public StoreException(String message, Throwable cause) {
        super(message, "The document store is currently unavailable. Please try again later.", cause);
    }
}
