package ch.so.arp.pdfrag.chat;

import java.util.List;

/**
 * Answer to a chat request together with the source files it was grounded on.
 */
public record ChatResponse(String response, List<String> sources) {
}
