package ch.so.arp.pdfrag.exception;

/**
 * Thrown when uploaded bytes cannot be turned into text, e.g. because the file is
 * not a PDF, is corrupt, encrypted or has no pages.
 */
public class ExtractionException extends RagException {

    private final String filename;

    public ExtractionException(String filename, String reason) {
        super("Failed to extract text from '" + filename + "': " + reason, userMessage(filename, reason));
        this.filename = filename;
    }

    public ExtractionException(String filename, String reason, Throwable cause) {
        super("Failed to extract text from '" + filename + "': " + reason, userMessage(filename, reason), cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }

    private static String userMessage(String filename, String reason) {
        return "The file '" + filename + "' could not be read as a PDF (" + reason + ").";
    }
}
