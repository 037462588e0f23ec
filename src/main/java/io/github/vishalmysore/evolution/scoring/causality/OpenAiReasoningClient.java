package io.github.vishalmysore.evolution.scoring.causality;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.evolution.domain.EventType;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat model whether event A caused event B and
 * parses {@code {"causality_score": 0.85, "explanation": "..."}} from the reply,
 * with or without a markdown code fence around it.
 */
public class OpenAiReasoningClient implements ReasoningClient {
    private static final ObjectMapper mapper = new ObjectMapper();

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public OpenAiReasoningClient(String apiKey, String baseUrl, String model) {
        this(apiKey, baseUrl, model, Duration.ofSeconds(60));
    }

    public OpenAiReasoningClient(String apiKey, String baseUrl, String model, Duration requestTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CausalAssessment assessCausality(EventType fromType, EventType toType, String fromText, String toText) {
        String prompt = "You are a financial risk analyst. Determine if Event A likely CAUSED Event B.\n\n"
                + "Event A:\nType: " + fromType + "\nDescription: " + fromText + "\n\n"
                + "Event B:\nType: " + toType + "\nDescription: " + toText + "\n\n"
                + "Assess the causal relationship on a scale of 0.0 to 1.0:\n"
                + "- 1.0: Event A directly caused Event B\n"
                + "- 0.7-0.9: Event A likely contributed to Event B\n"
                + "- 0.4-0.6: Possible indirect relationship\n"
                + "- 0.1-0.3: Weak or coincidental relationship\n"
                + "- 0.0: No causal relationship\n\n"
                + "Return ONLY a JSON object:\n"
                + "{\"causality_score\": 0.85, \"explanation\": \"Brief reasoning (max 50 words)\"}";

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", 0.2,
                "max_tokens", 200);

        String content = chat(body);
        return parseAssessment(content);
    }

    /**
     * Parses the model reply. Package-private for tests.
     */
    static CausalAssessment parseAssessment(String content) {
        String json = stripCodeFence(content);
        try {
            JsonNode node = mapper.readTree(json);
            JsonNode score = node.path("causality_score");
            if (!score.isNumber())
                throw new IllegalStateException("Reasoning reply has no numeric causality_score: " + content);
            String explanation = node.path("explanation").isTextual() ? node.path("explanation").asText() : null;
            return new CausalAssessment(score.asDouble(), explanation, false);
        } catch (IOException e) {
            throw new IllegalStateException("Reasoning reply is not JSON: " + content, e);
        }
    }

    private static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.contains("```json")) {
            trimmed = trimmed.split("```json", 2)[1];
            int end = trimmed.indexOf("```");
            return (end >= 0 ? trimmed.substring(0, end) : trimmed).trim();
        }
        if (trimmed.contains("```")) {
            String[] parts = trimmed.split("```");
            return parts.length > 1 ? parts[1].trim() : trimmed;
        }
        return trimmed;
    }

    private String chat(Map<String, Object> body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "chat/completions"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IllegalStateException("Reasoning API returned " + response.statusCode() + ": " + response.body());
            }
            JsonNode root = mapper.readTree(response.body());
            return root.path("choices").path(0).path("message").path("content").asText("");
        } catch (IOException e) {
            throw new IllegalStateException("Reasoning API call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during reasoning API call", e);
        }
    }

    @Override
    public String getName() {
        return "OpenAI-compatible reasoning (" + model + ")";
    }
}
