package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.ObservationDto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestObservations {

    private static final Instant BASE = Instant.parse("2024-05-01T08:00:00Z");

    private TestObservations() {
    }

    public static ObservationDto vehicles(long id, Integer vehicleCount) {
        return ObservationDto.builder()
                .id(id)
                .timestamp(BASE.plusSeconds(id * 60))
                .locationId(1)
                .vehicleCount(vehicleCount)
                .build();
    }

    public static ObservationDto reading(long id, Integer vehicleCount, Double avgSpeed, Double density) {
        return ObservationDto.builder()
                .id(id)
                .timestamp(BASE.plusSeconds(id * 60))
                .locationId(1)
                .vehicleCount(vehicleCount)
                .avgSpeed(avgSpeed)
                .minSpeed(avgSpeed == null ? null : avgSpeed - 5)
                .maxSpeed(avgSpeed == null ? null : avgSpeed + 10)
                .trafficDensityScore(density)
                .build();
    }

    /** Eleven readings of 49/50/51 vehicles followed by one reading of 90 (id 12). */
    public static List<ObservationDto> vehicleSpike() {
        int[] counts = {49, 50, 51, 50, 49, 51, 50, 50, 49, 51, 50, 90};
        List<ObservationDto> observations = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            observations.add(vehicles(i + 1, counts[i]));
        }
        return observations;
    }

    /** {@code normal} tightly clustered readings plus one far-off reading with id {@code normal + 1}. */
    public static List<ObservationDto> clusterWithOutlier(int normal) {
        List<ObservationDto> observations = new ArrayList<>();
        for (int i = 0; i < normal; i++) {
            observations.add(reading(i + 1, 45 + (i % 10), 38.0 + (i % 5), 0.50 + (i % 4) * 0.02));
        }
        observations.add(reading(normal + 1, 300, 5.0, 1.0));
        return observations;
    }

    public static DetectionContext context(List<ObservationDto> observations) {
        return DetectionContext.builder().observations(observations).seed(42L).build();
    }
}
