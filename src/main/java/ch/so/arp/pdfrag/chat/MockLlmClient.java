package ch.so.arp.pdfrag.chat;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted. It behaves like a model that sticks to its
 * instructions: without context it declines, otherwise it quotes the context.
 */
public class MockLlmClient implements LlmClient {

    static final String NO_INFORMATION = "I don't have enough information to answer this question.";

    private static final int QUOTE_LENGTH = 200;

    @Override
    public String complete(String prompt) {
        if (prompt.contains(AnswerComposer.NO_CONTEXT_NOTICE)) {
            return NO_INFORMATION;
        }
        int start = prompt.indexOf(AnswerComposer.CONTEXT_START);
        int end = prompt.indexOf(AnswerComposer.CONTEXT_END);
        if (start < 0 || end < start) {
            return "[mocked answer] Provide an API key to reach the real OpenAI service.";
        }
        String context = prompt.substring(start + AnswerComposer.CONTEXT_START.length(), end).strip();
        String quote = context.length() > QUOTE_LENGTH ? context.substring(0, QUOTE_LENGTH) + "..." : context;
        return "[mocked answer] Based on the provided context: " + quote;
    }
}
