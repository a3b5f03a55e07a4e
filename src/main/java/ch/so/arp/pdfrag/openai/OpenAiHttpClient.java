package ch.so.arp.pdfrag.openai;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.pdfrag.exception.ConfigurationException;

/**
 * Minimal JSON-over-HTTP client for the OpenAI REST API shared by the embedding
 * and chat integrations.
 */
public class OpenAiHttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiHttpClient.class);

    private static final int LOGGED_BODY_LENGTH = 500;

    private final OpenAiClientProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public OpenAiHttpClient(OpenAiClientProperties properties, ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new ConfigurationException(
                    "Property 'rag.openai.api-key' or OPENAI_API_KEY must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.httpClient = HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build();
    }

    OpenAiClientProperties properties() {
        return properties;
    }

    /**
     * POST the body as JSON to the given API path, e.g. {@code /embeddings}.
     *
     * @throws OpenAiApiException if the call fails or returns a non 2xx status
     */
    JsonNode post(String path, Object body) throws OpenAiApiException {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Request body is not serializable", ex);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + path))
                .timeout(properties.getTimeout())
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new OpenAiApiException("Interrupted while calling OpenAI " + path, 0, ex);
        } catch (IOException ex) {
            throw new OpenAiApiException("OpenAI " + path + " request failed: " + ex.getMessage(), 0, ex);
        }

        if (response.statusCode() >= 300) {
            LOGGER.warn("OpenAI {} returned HTTP {}: {}", path, response.statusCode(), abbreviate(response.body()));
            throw new OpenAiApiException("OpenAI " + path + " HTTP " + response.statusCode(), response.statusCode(),
                    null);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new OpenAiApiException("OpenAI " + path + " returned malformed JSON", response.statusCode(), ex);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > LOGGED_BODY_LENGTH ? body.substring(0, LOGGED_BODY_LENGTH) + "..." : body;
    }
}
