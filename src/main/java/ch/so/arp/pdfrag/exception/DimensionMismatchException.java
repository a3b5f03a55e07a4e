package ch.so.arp.pdfrag.exception;

/**
 * Raised when an embedding does not have the dimension the vector store was set
 * up with. This points at a drift between the configured model and the store and
 * always aborts the whole ingestion.
 */
public class DimensionMismatchException extends RagException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but got " + actual,
                "The document could not be indexed because of a server configuration problem.");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
