package com.strollie.planner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("EmbeddingClient")
class EmbeddingClientTest {

    private final EmbeddingClient client =
            new EmbeddingClient(mock(WebClient.class), new ApiKeysConfig(), new ObjectMapper());

    @Test
    @DisplayName("Vectors are placed by their index")
    void testParseByIndex() {
        String body = """
                {"data": [
                  {"index": 1, "embedding": [0.0, 1.0]},
                  {"index": 0, "embedding": [1.0, 0.0]}
                ]}
                """;
        List<double[]> vectors = client.parse(body, 2);
        assertArrayEquals(new double[]{1.0, 0.0}, vectors.get(0));
        assertArrayEquals(new double[]{0.0, 1.0}, vectors.get(1));
    }

    @Test
    @DisplayName("Missing vectors and API errors are failures")
    void testErrors() {
        assertThrows(IllegalStateException.class,
                () -> client.parse("{\"data\": [{\"index\": 0, \"embedding\": [1.0]}]}", 2));
        assertThrows(IllegalStateException.class,
                () -> client.parse("{\"error\": {\"message\": \"quota\"}}", 1));
    }

    @Test
    @DisplayName("Without configuration the call fails, empty input succeeds")
    void testNotConfigured() {
        assertFalse(client.isConfigured());
        StepVerifier.create(client.embed(List.of("текст"))).expectError(IllegalStateException.class).verify();
        StepVerifier.create(client.embed(List.of())).expectNext(List.of()).verifyComplete();
    }
}
