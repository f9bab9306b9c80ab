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

@DisplayName("LlmApiClient")
class LlmApiClientTest {

    private final LlmApiClient client =
            new LlmApiClient(mock(WebClient.class), new ApiKeysConfig(), new ObjectMapper());

    @Test
    @DisplayName("Message content of the first choice is returned")
    void testMessageContent() {
        String raw = "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"{\\\"summary\\\": \\\"ok\\\"}\"}}]}";
        assertEquals("{\"summary\": \"ok\"}", client.messageContent(raw));
    }

    @Test
    @DisplayName("Errors, empty bodies and missing choices fail")
    void testErrors() {
        assertThrows(IllegalStateException.class, () -> client.messageContent("{\"error\": {\"message\": \"bad key\"}}"));
        assertThrows(IllegalStateException.class, () -> client.messageContent(""));
        assertThrows(IllegalStateException.class, () -> client.messageContent("{\"choices\": []}"));
    }

    @Test
    @DisplayName("Unconfigured client fails without calling out")
    void testNotConfigured() {
        assertFalse(client.isConfigured());
        StepVerifier.create(client.explain(List.of(), "профиль"))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
