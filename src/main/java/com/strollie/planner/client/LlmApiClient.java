package com.strollie.planner.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.model.PlannedStop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class LlmApiClient {

    static final String EXPLAIN_SYSTEM_PROMPT = """
            You are a friendly city guide for Nizhny Novgorod.
            You receive a planned walking route and the traveller profile.
            For every stop write one short sentence on why it fits the traveller and, when useful, one practical tip.
            Then write a summary of the walk in 2-4 sentences and optional general notes.
            Keep stop order numbers exactly as given. Coffee breaks are short rests, describe them briefly.
            Language: Russian.
            """;

    private final WebClient webClient;
    private final ApiKeysConfig apiKeysConfig;
    private final ObjectMapper objectMapper;

    public boolean isConfigured() {
        ApiKeysConfig.Llm llm = apiKeysConfig.getLlm();
        return llm != null && llm.getBaseUrl() != null && llm.getKey() != null && !llm.getKey().isBlank();
    }

    /**
     * Asks the model to explain an itinerary. Emits the raw message content; parsing is left to the caller
     * because models do not always honour the response format.
     */
    public Mono<String> explain(List<PlannedStop> stops, String profileText) {
        if (!isConfigured()) {
            return Mono.error(new IllegalStateException("LLM is not configured"));
        }
        String stopsJson;
        try {
            stopsJson = objectMapper.writeValueAsString(stops.stream().map(LlmApiClient::describe).toList());
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        String userPrompt = String.format("Traveller profile: %s%n%nRoute stops JSON: %s", profileText, stopsJson);
        return callLlm(EXPLAIN_SYSTEM_PROMPT, userPrompt, explanationSchema(), "route_explanation");
    }

    private static Map<String, Object> describe(PlannedStop stop) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("order", stop.getOrder());
        map.put("name", stop.getName());
        map.put("category", stop.getCategory());
        map.put("arrival", stop.getArrivalTime() != null ? stop.getArrivalTime().toLocalTime().toString() : null);
        map.put("visitMinutes", stop.getVisitMinutes());
        map.put("coffeeBreak", stop.isBreakStop());
        if (stop.getAvailabilityNote() != null) {
            map.put("note", stop.getAvailabilityNote());
        }
        return map;
    }

    private static Map<String, Object> explanationSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "summary", Map.of("type", "string"),
                        "stops", Map.of(
                                "type", "array",
                                "items", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "order", Map.of("type", "integer"),
                                                "why", Map.of("type", "string"),
                                                "tip", Map.of("type", "string")
                                        ),
                                        "required", List.of("order", "why", "tip"),
                                        "additionalProperties", false
                                )
                        ),
                        "notes", Map.of("type", "array", "items", Map.of("type", "string"))
                ),
                "required", List.of("summary", "stops", "notes"),
                "additionalProperties", false
        );
    }

    private Mono<String> callLlm(String systemPrompt, String userPrompt, Map<String, Object> schema, String schemaName) {
        ApiKeysConfig.Llm llm = apiKeysConfig.getLlm();
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", llm.getModel());
        requestBody.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)
        ));
        requestBody.put("temperature", 0.5);
        requestBody.put("response_format", Map.of(
                "type", "json_schema",
                "json_schema", Map.of(
                        "name", schemaName,
                        "strict", true,
                        "schema", schema
                )
        ));
        requestBody.put("max_tokens", llm.getMaxTokens() > 0 ? llm.getMaxTokens() : 1000);

        return Mono.defer(() -> webClient.post()
                        .uri(llm.getBaseUrl() + "/chat/completions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(requestBody)
                        .retrieve()
                        .bodyToMono(String.class))
                .map(this::messageContent);
    }

    String messageContent(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new IllegalStateException("Empty LLM response");
        }
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(rawResponse);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable LLM response: " + e.getOriginalMessage(), e);
        }
        if (rootNode.has("error")) {
            log.error("LLM API Error: {}", rootNode.get("error").toPrettyString());
            throw new IllegalStateException("LLM API error");
        }
        JsonNode choices = rootNode.path("choices");
        if (choices.isEmpty()) {
            throw new IllegalStateException("LLM response has no choices");
        }
        return choices.get(0).path("message").path("content").asText("");
    }
}
