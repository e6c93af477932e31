package com.patternscope.simulator.service;

import com.patternscope.simulator.model.TrafficEventEntity;
import com.patternscope.simulator.repository.TrafficEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

@Slf4j
@Service
public class TrafficSeedService {

    private final TrafficEventRepository trafficEventRepository;
    private final Clock clock;
    private final int events;
    private final int days;
    private final long seed;
    private final double anomalyRate;

    public TrafficSeedService(TrafficEventRepository trafficEventRepository,
                              Clock clock,
                              @Value("${simulator.events:2000}") int events,
                              @Value("${simulator.days:7}") int days,
                              @Value("${simulator.seed:42}") long seed,
                              @Value("${simulator.anomaly-rate:0.05}") double anomalyRate) {
        if (events < 0 || days <= 0) {
            throw new IllegalArgumentException("simulator.events must be >= 0 and simulator.days > 0");
        }
        this.trafficEventRepository = trafficEventRepository;
        this.clock = clock;
        this.events = events;
        this.days = days;
        this.seed = seed;
        this.anomalyRate = anomalyRate;
    }

    /**
     * Generates the configured number of events spread over the trailing window and saves them
     * in one batch, oldest first.
     *
     * @return number of events saved
     */
    public int seed() {
        Instant end = clock.instant();
        long windowSeconds = Duration.ofDays(days).toSeconds();
        Instant start = end.minusSeconds(windowSeconds);

        Random timestamps = new Random(seed);
        TrafficDataGenerator generator = new TrafficDataGenerator(seed + 1, anomalyRate);
        List<TrafficEventEntity> trafficEventEntityList = new ArrayList<>(events);
        for (int i = 0; i < events; i++) {
            Instant timestamp = start.plusSeconds((long) (timestamps.nextDouble() * windowSeconds));
            trafficEventEntityList.add(generator.generate(timestamp));
        }
        trafficEventEntityList.sort(Comparator.comparing(TrafficEventEntity::getTimestamp));

        trafficEventRepository.saveAll(trafficEventEntityList);
        log.info("Saved {} traffic events between {} and {} ({} with injected anomalies)",
                trafficEventEntityList.size(), start, end, generator.getInjectedAnomalies());
        return trafficEventEntityList.size();
    }
}
