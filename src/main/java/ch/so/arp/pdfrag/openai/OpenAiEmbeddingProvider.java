package ch.so.arp.pdfrag.openai;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ch.so.arp.pdfrag.embedding.EmbeddingProvider;
import ch.so.arp.pdfrag.exception.EmbeddingProviderException;

/**
 * {@link EmbeddingProvider} calling the OpenAI {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final OpenAiHttpClient client;

    public OpenAiEmbeddingProvider(OpenAiHttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        String model = client.properties().getEmbeddingModel();
        LOGGER.debug("Requesting {} embeddings from model {}", texts.size(), model);
        JsonNode response;
        try {
            response = client.post("/embeddings", Map.of("model", model, "input", texts));
        } catch (OpenAiApiException ex) {
            throw new EmbeddingProviderException(ex.getMessage(), ex.isRateLimited(), ex);
        }

        JsonNode data = response.path("data");
        if (!data.isArray()) {
            throw new EmbeddingProviderException("OpenAI embeddings response contains no data array", null);
        }
        List<JsonNode> items = new ArrayList<>();
        data.forEach(items::add);
        items.sort(Comparator.comparingInt(item -> item.path("index").asInt()));

        List<float[]> vectors = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonNode embedding = item.path("embedding");
            if (!embedding.isArray()) {
                throw new EmbeddingProviderException("OpenAI embeddings response item has no embedding", null);
            }
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
