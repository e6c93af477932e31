package com.patternscope.simulator.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatorPropertiesTest {

    private Properties applicationProperties() {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        return yaml.getObject();
    }

    @Test
    void doesNotConfigureJdbcBatchingForIdentityKeys() {
        // identity ids force one insert per row, so a batch size would be ignored
        assertThat(applicationProperties().stringPropertyNames())
                .noneMatch(name -> name.contains("batch_size"));
    }

    @Test
    void declaresSeedingDefaults() {
        Properties properties = applicationProperties();

        assertThat(properties.getProperty("simulator.events")).isEqualTo("${SIMULATOR_EVENTS:2000}");
        assertThat(properties.getProperty("spring.main.web-application-type")).isEqualTo("none");
    }
}
