package ch.so.arp.pdfrag.openai;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.pdfrag.chat.LlmClient;
import ch.so.arp.pdfrag.exception.GenerationProviderException;

/**
 * {@link LlmClient} calling the OpenAI {@code /chat/completions} endpoint with a
 * single user message.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiHttpClient client;

    public OpenAiLlmClient(OpenAiHttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String complete(String prompt) {
        OpenAiClientProperties properties = client.properties();
        LOGGER.debug("Requesting completion from model {} via base URL {}", properties.getChatModel(),
                properties.getBaseUrl());
        Map<String, Object> body = Map.of(
                "model", properties.getChatModel(),
                "temperature", properties.getTemperature(),
                "messages", List.of(Map.of("role", "user", "content", prompt)));
        JsonNode response;
        try {
            response = client.post("/chat/completions", body);
        } catch (OpenAiApiException ex) {
            throw new GenerationProviderException(ex.getMessage(), ex.isRateLimited(), ex);
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new GenerationProviderException("OpenAI chat response contains no message content", null);
        }
        return content.asText();
    }
}
