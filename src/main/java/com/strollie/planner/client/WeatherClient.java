package com.strollie.planner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.GeoPoint;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.WeatherSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Current conditions from wttr.in. Completes empty on any failure; weather only tunes the scoring.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeatherClient {

    private static final String DEFAULT_BASE_URL = "https://wttr.in";

    private final WebClient webClient;
    private final ApiKeysConfig config;
    private final PlannerProperties properties;
    private final ObjectMapper mapper;

    public Mono<WeatherSnapshot> snapshot(GeoPoint point, Intensity intensity) {
        String url = String.format(Locale.ROOT, "%s/%.4f,%.4f?format=j1", baseUrl(), point.lat(), point.lon());
        return Mono.defer(() -> webClient.get()
                        .uri(url)
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(String.class))
                .timeout(properties.getWeatherTimeout())
                .map(body -> parse(body, intensity))
                .doOnNext(w -> log.info("Weather: {} {}°C, precip {} mm", w.getDescription(),
                        w.getTemperatureC(), w.getPrecipitationMm()))
                .onErrorResume(e -> {
                    log.warn("Weather unavailable: {}", e.toString());
                    return Mono.empty();
                });
    }

    WeatherSnapshot parse(String body, Intensity intensity) {
        JsonNode current;
        try {
            current = mapper.readTree(body).path("current_condition").path(0);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable weather response: " + e.getMessage(), e);
        }
        if (current.isMissingNode()) {
            throw new IllegalStateException("Weather response has no current condition");
        }

        String description = current.path("weatherDesc").path(0).path("value").asText("").trim();
        Double temperature = number(current.path("temp_C"));
        double precipitation = orZero(number(current.path("precipMM")));
        double wind = orZero(number(current.path("windspeedKmph")));
        String code = current.path("weatherCode").asText("");

        return WeatherSnapshot.builder()
                .description(description.isEmpty() ? null : description)
                .conditionKey(description.isEmpty() ? code : description.toLowerCase(Locale.ROOT))
                .temperatureC(temperature)
                .precipitationMm(precipitation)
                .windKmph(wind)
                .advice(advice(description, temperature, precipitation, wind, intensity))
                .build();
    }

    static String advice(String description, Double temperature, double precipitation, double wind,
                         Intensity intensity) {
        List<String> fragments = new ArrayList<>();
        if (precipitation >= 1.0) {
            fragments.add("Сегодня дождливо — возьмите зонт");
        } else if (precipitation > 0.1) {
            fragments.add("Возможен лёгкий дождь, захватите ветровку");
        } else if (wind >= 25) {
            fragments.add("На улице ветрено, планируйте уютные остановки");
        } else if (description != null && !description.isBlank()) {
            String lowered = description.toLowerCase(Locale.ROOT);
            fragments.add(Character.toUpperCase(lowered.charAt(0)) + lowered.substring(1));
        } else {
            fragments.add("Погода располагает к прогулке");
        }

        List<String> clothing = new ArrayList<>();
        if (temperature != null) {
            long rounded = Math.round(temperature);
            fragments.add("температура около " + rounded + "°C");
            if (rounded <= -10) {
                clothing.add("очень тёплую куртку и термоперчатки");
            } else if (rounded <= 0) {
                clothing.add("слоистую одежду и шапку");
            } else if (rounded <= 10) {
                clothing.add("ветровку или лёгкое пальто");
            } else if (rounded >= 24) {
                clothing.add("дышащую одежду и головной убор");
            }
        }
        if (precipitation >= 0.3) {
            clothing.add("непромокаемую обувь");
        }
        clothing.add(intensity == Intensity.INTENSE
                ? "удобные кроссовки и лёгкий рюкзак для воды"
                : "комфортную обувь для долгой прогулки");

        return String.join(", ", fragments) + ". Рекомендовано: " + String.join(", ", clothing);
    }

    private static Double number(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private String baseUrl() {
        if (config.getWeather() == null || config.getWeather().getBaseUrl() == null
                || config.getWeather().getBaseUrl().isBlank()) {
            return DEFAULT_BASE_URL;
        }
        return config.getWeather().getBaseUrl();
    }
}
