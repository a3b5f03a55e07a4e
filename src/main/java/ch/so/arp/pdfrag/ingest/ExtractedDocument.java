package ch.so.arp.pdfrag.ingest;

import java.util.Objects;

/**
 * Plain text of an uploaded document and the number of pages it was read from.
 */
public record ExtractedDocument(String text, int pageCount) {

    public ExtractedDocument {
        Objects.requireNonNull(text, "text");
    }
}
