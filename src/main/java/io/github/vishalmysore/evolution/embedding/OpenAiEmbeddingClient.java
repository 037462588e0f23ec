package io.github.vishalmysore.evolution.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Embedding and sentiment client for OpenAI-compatible endpoints (NVIDIA NIM,
 * OpenAI, Azure OpenAI, local vLLM, etc.).
 *
 * Embeddings come from {@code /embeddings}. Sentiment is asked of a chat model
 * via {@code /chat/completions} and parsed from a bare number in [-1, 1].
 * Every failure surfaces as {@link EmbeddingUnavailableException}.
 */
public class OpenAiEmbeddingClient implements EmbeddingClient {
    private static final Logger log = Logger.getLogger(OpenAiEmbeddingClient.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper();

    // Avoid token limits on long descriptions
    private static final int MAX_INPUT_CHARS = 500;

    private final String apiKey;
    private final String baseUrl;
    private final String embeddingModel;
    private final String chatModel;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public OpenAiEmbeddingClient(String apiKey, String baseUrl, String embeddingModel, String chatModel) {
        this(apiKey, baseUrl, embeddingModel, chatModel, Duration.ofSeconds(30));
    }

    public OpenAiEmbeddingClient(String apiKey, String baseUrl, String embeddingModel, String chatModel,
            Duration requestTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.embeddingModel = embeddingModel;
        this.chatModel = chatModel;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public double[] embed(String text) {
        Map<String, Object> body = Map.of(
                "model", embeddingModel,
                "input", truncate(text));
        JsonNode root = post("embeddings", body);
        JsonNode embeddingArray = root.path("data").path(0).path("embedding");

        if (embeddingArray.isMissingNode() || !embeddingArray.isArray() || embeddingArray.size() == 0) {
            throw new EmbeddingUnavailableException("Unexpected embedding response structure");
        }

        double[] embedding = new double[embeddingArray.size()];
        for (int i = 0; i < embeddingArray.size(); i++) {
            embedding[i] = embeddingArray.get(i).asDouble();
        }
        return embedding;
    }

    @Override
    public double sentiment(String text) {
        if (chatModel == null)
            throw new EmbeddingUnavailableException("No chat model configured for sentiment");

        String prompt = "You are a financial sentiment analyst. Rate the sentiment of this financial event "
                + "from -1.0 (very negative) to 1.0 (very positive), 0.0 being neutral.\n\n"
                + "Event: " + truncate(text) + "\n\n"
                + "Return ONLY a number between -1.0 and 1.0 (e.g., -0.75)";
        Map<String, Object> body = Map.of(
                "model", chatModel,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", 0.1,
                "max_tokens", 10);
        JsonNode root = post("chat/completions", body);
        String content = root.path("choices").path(0).path("message").path("content").asText("").trim();

        try {
            double score = Double.parseDouble(content);
            return Math.max(-1.0, Math.min(1.0, score));
        } catch (NumberFormatException e) {
            throw new EmbeddingUnavailableException("Sentiment response is not a number: " + content, e);
        }
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EmbeddingUnavailableException(path + " returned " + response.statusCode() + ": " + response.body());
            }
            return mapper.readTree(response.body());
        } catch (IOException e) {
            log.warning("Call to " + path + " failed: " + e.getMessage());
            throw new EmbeddingUnavailableException("Call to " + path + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Interrupted while calling " + path, e);
        }
    }

    private static String truncate(String text) {
        if (text == null)
            return "";
        return text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
    }

    @Override
    public String getName() {
        return "OpenAI-compatible (" + embeddingModel + " via " + baseUrl + ")";
    }
}
