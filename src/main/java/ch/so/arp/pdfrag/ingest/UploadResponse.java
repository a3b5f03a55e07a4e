package ch.so.arp.pdfrag.ingest;

/**
 * Response body of a document upload.
 */
public record UploadResponse(String message, String filename, String fingerprint, int chunkCount,
        IngestionOutcome outcome) {

    static UploadResponse from(IngestionResult result) {
        return new UploadResponse(result.message(), result.filename(), result.fingerprint(), result.chunkCount(),
                result.outcome());
    }
}
