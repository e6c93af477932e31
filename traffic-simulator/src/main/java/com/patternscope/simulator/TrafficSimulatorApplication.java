package com.patternscope.simulator;

import com.patternscope.simulator.service.TrafficSeedService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@SpringBootApplication
public class TrafficSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrafficSimulatorApplication.class, args);
    }

    @Bean
    public CommandLineRunner seedTrafficEvents(TrafficSeedService trafficSeedService) {
        return args -> {
            log.info("Seeding traffic events...");
            int saved = trafficSeedService.seed();
            log.info("Seeding traffic events Completed, {} events saved", saved);
        };
    }
}
