package ch.so.arp.pdfrag.ingest;

public enum IngestionOutcome {
    PROCESSED,
    ALREADY_PROCESSED,
    NO_CONTENT
}
