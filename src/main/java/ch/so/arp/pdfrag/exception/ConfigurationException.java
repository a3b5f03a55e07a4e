package ch.so.arp.pdfrag.exception;

/**
 * Invalid or inconsistent configuration detected at startup or while serving a
 * request, e.g. a query embedding model that does not match the stored vectors.
 */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(message, "The service is misconfigured. Please contact the administrator.");
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, "The service is misconfigured. Please contact the administrator.", cause);
    }
}
