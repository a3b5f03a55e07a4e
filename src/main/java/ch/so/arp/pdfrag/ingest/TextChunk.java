package ch.so.arp.pdfrag.ingest;

/**
 * Contiguous span {@code [start, end)} of a document's text. {@code overlap} is the
 * number of leading characters this chunk shares with its predecessor.
 */
public record TextChunk(int index, String text, int start, int end, int overlap) {
}
