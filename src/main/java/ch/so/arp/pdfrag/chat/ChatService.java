package ch.so.arp.pdfrag.chat;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates the retrieval of context from the vector store and delegates the
 * answer generation to the large language model integration.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private static final int LOGGED_QUERY_LENGTH = 100;

    private final RetrievalEngine retrievalEngine;
    private final AnswerComposer answerComposer;
    private final Executor ragExecutor;

    public ChatService(RetrievalEngine retrievalEngine, AnswerComposer answerComposer, Executor ragExecutor) {
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
        this.answerComposer = Objects.requireNonNull(answerComposer, "answerComposer");
        this.ragExecutor = Objects.requireNonNull(ragExecutor, "ragExecutor");
    }

    public CompletableFuture<ChatResponse> answerAsync(String query) {
        return CompletableFuture.supplyAsync(() -> answer(query), ragExecutor);
    }

    public ChatResponse answer(String query) {
        LOGGER.info("Processing query: {}", abbreviate(query));
        RetrievalResult result = retrievalEngine.retrieve(query);
        if (result.isEmpty()) {
            LOGGER.info("No passages found, answering without context");
        }
        String answer = answerComposer.compose(query, result);
        LOGGER.info("Successfully generated response from {} passages", result.contexts().size());
        return new ChatResponse(answer, result.sources());
    }

    private static String abbreviate(String query) {
        return query.length() > LOGGED_QUERY_LENGTH ? query.substring(0, LOGGED_QUERY_LENGTH) + "..." : query;
    }
}
