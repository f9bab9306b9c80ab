package com.strollie.planner.explain;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a model reply into a {@link RouteExplanation}, trying each strategy in turn:
 * the whole reply as JSON, a fenced {@code ```json} block, then the first balanced {@code {...}} object.
 */
@Slf4j
public class ExplanationParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    @FunctionalInterface
    interface Strategy {
        Optional<String> extract(String reply);
    }

    private final ObjectMapper objectMapper;
    private final List<Strategy> strategies;

    public ExplanationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strategies = List.of(
                reply -> Optional.of(reply.trim()),
                ExplanationParser::fenced,
                ExplanationParser::firstObject
        );
    }

    public Optional<RouteExplanation> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        for (Strategy strategy : strategies) {
            Optional<String> candidate = strategy.extract(reply);
            if (candidate.isEmpty()) {
                continue;
            }
            try {
                RouteExplanation explanation = objectMapper.readValue(candidate.get(), RouteExplanation.class);
                if (explanation.getSummary() != null && !explanation.getSummary().isBlank()) {
                    return Optional.of(explanation);
                }
            } catch (Exception e) {
                log.debug("Explanation strategy failed: {}", e.getMessage());
            }
        }
        log.warn("Could not read an explanation from the model reply ({} chars)", reply.length());
        return Optional.empty();
    }

    static Optional<String> fenced(String reply) {
        Matcher matcher = FENCED.matcher(reply);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    static Optional<String> firstObject(String reply) {
        int start = reply.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < reply.length(); i++) {
            char c = reply.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(reply.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
