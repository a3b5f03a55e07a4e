package ch.so.arp.pdfrag.ingest;

import ch.so.arp.pdfrag.exception.ExtractionException;

/**
 * Converts the raw bytes of an uploaded file into plain text. Implementations work
 * purely in memory and never persist the uploaded content.
 */
public interface TextExtractor {

    /**
     * Extract the text of the given document.
     *
     * @param content  the raw file content
     * @param filename the original filename, used for error reporting
     * @return the extracted text together with basic document information
     * @throws ExtractionException if the bytes do not form a readable document
     */
    ExtractedDocument extract(byte[] content, String filename);
}
