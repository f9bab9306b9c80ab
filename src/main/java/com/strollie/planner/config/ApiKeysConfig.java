package com.strollie.planner.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "api")
public class ApiKeysConfig {
    private Gis gis;
    private Routing routing;
    private Llm llm;
    private Weather weather;

    @Data
    public static class Gis {
        private String baseUrl;
        private String key;
        private int timeout;
        private int maxPlacesPerCategory;
        private int searchRadiusMeters = 5000;
    }

    @Data
    public static class Routing {
        private String baseUrl;
        /** Falls back to the catalog key when empty. */
        private String key;
        private int timeout;
    }

    @Data
    public static class Llm {
        private String provider;
        private String baseUrl;
        private String key;
        private String model;
        private String embeddingModel;
        private int maxTokens;
        private int timeout;
    }

    @Data
    public static class Weather {
        private String baseUrl;
        private int timeout;
    }

    @PostConstruct
    public void validate() {
        if (gis == null || gis.getKey() == null || gis.getKey().trim().isEmpty()) {
            log.error("GIS API key is missing!");
            throw new IllegalStateException("GIS API key is not configured");
        }

        String maskedGisKey = maskKey(gis.getKey());
        String maskedLlmKey = llm != null ? maskKey(llm.getKey()) : "<none>";

        log.info("==== Loaded API Configuration ====");
        log.info("GIS:");
        log.info("  baseUrl: {}", gis.getBaseUrl());
        log.info("  key: {}", maskedGisKey);
        log.info("  timeout: {}", gis.getTimeout());
        log.info("  maxPlacesPerCategory: {}", gis.getMaxPlacesPerCategory());

        if (routing != null) {
            log.info("Routing:");
            log.info("  baseUrl: {}", routing.getBaseUrl());
            log.info("  key: {}", routing.getKey() == null || routing.getKey().isBlank()
                    ? "<catalog key>" : maskKey(routing.getKey()));
        } else {
            log.warn("Routing config not provided, legs will be estimated");
        }

        if (llm != null) {
            log.info("LLM:");
            log.info("  provider: {}", llm.getProvider());
            log.info("  baseUrl: {}", llm.getBaseUrl());
            log.info("  key: {}", maskedLlmKey);
            log.info("  model: {}", llm.getModel());
            log.info("  embeddingModel: {}", llm.getEmbeddingModel());
            log.info("  maxTokens: {}", llm.getMaxTokens());
        } else {
            log.warn("LLM config not provided");
        }

        if (weather != null) {
            log.info("Weather:");
            log.info("  baseUrl: {}", weather.getBaseUrl());
        }

        log.info("==== API Configuration Loaded Successfully ====");
    }

    public String routingKey() {
        if (routing != null && routing.getKey() != null && !routing.getKey().isBlank()) {
            return routing.getKey().trim();
        }
        return gis.getKey().trim();
    }

    static String maskKey(String key) {
        if (key == null || key.length() <= 4) return "****";
        return key.substring(0, 4) + "****";
    }

}
