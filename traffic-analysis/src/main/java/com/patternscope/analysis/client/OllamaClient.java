package com.patternscope.analysis.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Text generation through the Ollama {@code /api/generate} endpoint. Failures are thrown to the
 * caller as {@link org.springframework.web.client.RestClientException}s.
 */
@Slf4j
@Component
public class OllamaClient {

    private static final String EMPTY_RESPONSE = "No suggestions generated";

    private final RestClient restClient;
    private final String model;

    public OllamaClient(@Qualifier("ollamaRestClient") RestClient restClient,
                        @Value("${llm.ollama.model:llama2}") String model) {
        this.restClient = restClient;
        this.model = model;
    }

    public String generate(String prompt) {
        Map<String, Object> payload = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", Map.of("temperature", 0.7, "top_p", 0.9));

        log.info("Calling Ollama model {} with prompt of {} chars", model, prompt.length());
        JsonNode response = restClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);
        if (response == null || !response.hasNonNull("response")) {
            return EMPTY_RESPONSE;
        }
        return response.get("response").asText();
    }
}
