package ch.so.arp.pdfrag.ingest;

/**
 * Outcome of a single document ingestion.
 *
 * @param filename    original filename of the upload
 * @param fingerprint content fingerprint, {@code null} if the document had no text
 * @param chunkCount  number of chunks stored for the fingerprint
 * @param outcome     what the pipeline did with the document
 */
public record IngestionResult(String filename, String fingerprint, int chunkCount, IngestionOutcome outcome) {

    static IngestionResult processed(String filename, String fingerprint, int chunkCount) {
        return new IngestionResult(filename, fingerprint, chunkCount, IngestionOutcome.PROCESSED);
    }

    static IngestionResult alreadyProcessed(String filename, String fingerprint, int chunkCount) {
        return new IngestionResult(filename, fingerprint, chunkCount, IngestionOutcome.ALREADY_PROCESSED);
    }

    static IngestionResult noContent(String filename) {
        return new IngestionResult(filename, null, 0, IngestionOutcome.NO_CONTENT);
    }

    public String message() {
        return switch (outcome) {
            case PROCESSED -> "Document '" + filename + "' processed and stored successfully (" + chunkCount + " chunks).";
            case ALREADY_PROCESSED -> "Document '" + filename + "' already processed and stored.";
            case NO_CONTENT -> "Document '" + filename + "' contains no extractable text.";
        };
    }
}
