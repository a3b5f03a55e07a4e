package ch.so.arp.pdfrag.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for chat requests.
 */
public record ChatRequest(@NotBlank String query) {
}
