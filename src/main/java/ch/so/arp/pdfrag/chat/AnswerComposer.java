package ch.so.arp.pdfrag.chat;

import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.pdfrag.exception.GenerationProviderException;

/**
 * Builds a grounded prompt out of the retrieved passages and the user question and
 * asks the language model for the answer. There is exactly one model call per
 * question and no retry.
 */
public class AnswerComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerComposer.class);

    static final String INSTRUCTION = """
            Answer the following question based only on the provided context.
            If the context does not contain enough information to answer the question,
            say that you don't have enough information.""";

    static final String NO_CONTEXT_NOTICE = "No relevant passages were found in the uploaded documents. "
            + "State that you don't have enough information to answer the question.";

    static final String CONTEXT_START = "<context>";
    static final String CONTEXT_END = "</context>";

    private final LlmClient llmClient;

    public AnswerComposer(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    public String compose(String query, RetrievalResult result) {
        String prompt = buildPrompt(query, result);
        LOGGER.debug("Sending prompt with {} passages ({} characters)", result.contexts().size(), prompt.length());
        try {
            return llmClient.complete(prompt);
        } catch (GenerationProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new GenerationProviderException("Language model call failed: " + ex.getMessage(), ex);
        }
    }

    String buildPrompt(String query, RetrievalResult result) {
        String context = result.isEmpty()
                ? NO_CONTEXT_NOTICE
                : result.contexts().stream().map(RetrievedContext::formatForPrompt).collect(Collectors.joining("\n\n"));
        return INSTRUCTION + "\n\n"
                + CONTEXT_START + "\n" + context + "\n" + CONTEXT_END + "\n\n"
                + "Question: " + query;
    }
}
