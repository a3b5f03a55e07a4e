package ch.so.arp.pdfrag.chat;

import ch.so.arp.pdfrag.exception.GenerationProviderException;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate a completion for the prompt.
     *
     * @param prompt the full prompt including instructions and context
     * @return the generated text
     * @throws GenerationProviderException if the model cannot be reached
     */
    String complete(String prompt);
}
