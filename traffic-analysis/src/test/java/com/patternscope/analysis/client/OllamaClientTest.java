package com.patternscope.analysis.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaClientTest {

    private MockRestServiceServer server;
    private OllamaClient ollamaClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://ollama.test:11434");
        server = MockRestServiceServer.bindTo(builder).build();
        ollamaClient = new OllamaClient(builder.build(), "llama2");
    }

    @Test
    void returnsGeneratedText() {
        server.expect(requestTo("http://ollama.test:11434/api/generate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("llama2"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.prompt").value("hello"))
                .andExpect(jsonPath("$.options.temperature").value(0.7))
                .andRespond(withSuccess("{\"model\":\"llama2\",\"response\":\"- Adjust signal timing\",\"done\":true}",
                        MediaType.APPLICATION_JSON));

        assertThat(ollamaClient.generate("hello")).isEqualTo("- Adjust signal timing");
        server.verify();
    }

    @Test
    void missingResponseFieldGivesPlaceholder() {
        server.expect(requestTo("http://ollama.test:11434/api/generate"))
                .andRespond(withSuccess("{\"done\":true}", MediaType.APPLICATION_JSON));

        assertThat(ollamaClient.generate("hello")).isEqualTo("No suggestions generated");
    }

    @Test
    void serverErrorPropagates() {
        server.expect(requestTo("http://ollama.test:11434/api/generate"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> ollamaClient.generate("hello"))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
