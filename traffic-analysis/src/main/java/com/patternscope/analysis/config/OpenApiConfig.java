package com.patternscope.analysis.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI patternScopeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PatternScope Analysis API")
                        .version("0.1.0")
                        .description(
                                "Anomaly detection over traffic sensor readings.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Fetch traffic events for the requested period\n" +
                                "2. Run the requested detectors: `zscore`, `iqr`, `isolation_forest`, `lof`\n" +
                                "3. Keep the highest-confidence finding per traffic event\n" +
                                "4. Persist anomalies and attach an LLM-written trend suggestion"));
    }
}
