package com.strollie.planner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /embeddings}. One vector per input text, in input order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmbeddingClient {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final WebClient webClient;
    private final ApiKeysConfig apiKeysConfig;
    private final ObjectMapper objectMapper;

    public boolean isConfigured() {
        ApiKeysConfig.Llm llm = apiKeysConfig.getLlm();
        return llm != null && llm.getBaseUrl() != null && llm.getKey() != null && !llm.getKey().isBlank();
    }

    public Mono<List<double[]>> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return Mono.just(List.of());
        }
        if (!isConfigured()) {
            return Mono.error(new IllegalStateException("Embedding service is not configured"));
        }
        ApiKeysConfig.Llm llm = apiKeysConfig.getLlm();
        String model = llm.getEmbeddingModel() != null ? llm.getEmbeddingModel() : DEFAULT_MODEL;
        Map<String, Object> requestBody = Map.of("model", model, "input", texts);

        return Mono.defer(() -> webClient.post()
                        .uri(llm.getBaseUrl() + "/embeddings")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(requestBody)
                        .retrieve()
                        .bodyToMono(String.class))
                .map(raw -> parse(raw, texts.size()));
    }

    List<double[]> parse(String raw, int expected) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable embeddings response: " + e.getMessage(), e);
        }
        if (root.has("error")) {
            throw new IllegalStateException("Embeddings API error: " + root.get("error").toString());
        }
        double[][] vectors = new double[expected][];
        int fallbackIndex = 0;
        for (JsonNode item : root.path("data")) {
            int index = item.path("index").asInt(fallbackIndex++);
            if (index < 0 || index >= expected) {
                continue;
            }
            JsonNode embedding = item.path("embedding");
            double[] vector = new double[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = embedding.get(i).asDouble();
            }
            vectors[index] = vector;
        }
        List<double[]> result = new ArrayList<>(expected);
        for (double[] vector : vectors) {
            if (vector == null) {
                throw new IllegalStateException("Embeddings response has " + root.path("data").size()
                        + " vectors for " + expected + " inputs");
            }
            result.add(vector);
        }
        log.debug("Received {} embeddings", result.size());
        return result;
    }
}
