package ch.so.arp.pdfrag.openai;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to connect to OpenAI.
 */
@ConfigurationProperties(prefix = "rag.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the OpenAI service. Falls back to the
     * {@code OPENAI_API_KEY} environment variable.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Model used to embed chunks and queries.
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Name of the chat model that generates answers.
     */
    private String chatModel = "gpt-3.5-turbo";

    /**
     * Sampling temperature of the chat model.
     */
    private double temperature = 0.0d;

    /**
     * Connect and request timeout of every API call.
     */
    private Duration timeout = Duration.ofSeconds(60);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("OPENAI_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    public String getChatModel() {
        return chatModel;
    }

    public void setChatModel(String chatModel) {
        this.chatModel = chatModel;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
