package com.patternscope.analysis.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Slf4j
@Configuration
public class LlmConfig {

    @Bean
    RestClient ollamaRestClient(RestClient.Builder builder,
                                @Value("${llm.ollama.url:http://ollama:11434}") String url,
                                @Value("${llm.ollama.timeout-seconds:30}") int timeoutSeconds) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(Math.min(timeoutSeconds, 10)));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        log.info("Ollama client configured: url={} readTimeoutSeconds={}", url, timeoutSeconds);
        return builder
                .baseUrl(url.endsWith("/") ? url.substring(0, url.length() - 1) : url)
                .requestFactory(requestFactory)
                .build();
    }
}
