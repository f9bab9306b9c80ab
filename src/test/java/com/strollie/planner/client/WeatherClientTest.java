package com.strollie.planner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.model.Intensity;
import com.strollie.planner.model.WeatherSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("WeatherClient")
class WeatherClientTest {

    private final WeatherClient client = new WeatherClient(mock(WebClient.class), new ApiKeysConfig(),
            new PlannerProperties(), new ObjectMapper());

    @Test
    @DisplayName("Current condition is read with advice")
    void testParse() {
        String body = """
                {"current_condition": [{
                  "temp_C": "3", "precipMM": "1.6", "windspeedKmph": "14", "weatherCode": "302",
                  "weatherDesc": [{"value": "Moderate rain"}]
                }]}
                """;
        WeatherSnapshot snapshot = client.parse(body, Intensity.MEDIUM);
        assertEquals("Moderate rain", snapshot.getDescription());
        assertEquals(3.0, snapshot.getTemperatureC());
        assertEquals(1.6, snapshot.getPrecipitationMm(), 1e-9);
        assertTrue(snapshot.isPrecipitation());
        assertEquals("Сегодня дождливо — возьмите зонт, температура около 3°C. Рекомендовано: "
                + "ветровку или лёгкое пальто, непромокаемую обувь, комфортную обувь для долгой прогулки",
                snapshot.getAdvice());
    }

    @Test
    @DisplayName("Calm weather advice follows the description")
    void testAdviceCalm() {
        assertEquals("Sunny, температура около 26°C. Рекомендовано: дышащую одежду и головной убор, "
                        + "удобные кроссовки и лёгкий рюкзак для воды",
                WeatherClient.advice("SUNNY", 25.6, 0.0, 5, Intensity.INTENSE));
        assertEquals("Погода располагает к прогулке. Рекомендовано: комфортную обувь для долгой прогулки",
                WeatherClient.advice(null, null, 0.0, 0, Intensity.RELAXED));
    }

    @Test
    @DisplayName("Response without current condition is an error")
    void testMissingCondition() {
        assertThrows(IllegalStateException.class, () -> client.parse("{}", Intensity.MEDIUM));
        assertThrows(IllegalStateException.class, () -> client.parse("Unknown location", Intensity.MEDIUM));
    }
}
