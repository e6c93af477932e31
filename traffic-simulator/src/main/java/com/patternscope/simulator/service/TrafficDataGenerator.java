package com.patternscope.simulator.service;

import com.patternscope.simulator.model.TrafficEventEntity;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Produces plausible sensor readings for a timestamp, occasionally distorted so the
 * analysis service has something to find. Not thread-safe.
 */
public class TrafficDataGenerator {

    static final List<Integer> LOCATION_IDS = List.of(1, 2, 3, 4, 5);
    private static final String[] COLORS = {"white", "black", "silver", "gray", "red", "blue", "brown", "green", "yellow"};
    private static final double[] COLOR_SHARES = {0.24, 0.22, 0.16, 0.14, 0.10, 0.08, 0.03, 0.02, 0.01};
    private static final String[] WEATHER = {"clear", "rainy", "cloudy"};
    private static final String[] VISIBILITY = {"good", "moderate", "poor"};
    private static final double MIN_SPEED = 5;

    enum InjectedAnomaly { HIGH_SPEED, LOW_SPEED, HIGH_DENSITY, LOW_DENSITY }

    private final Random rnd;
    private final double anomalyRate;

    @Getter
    private int injectedAnomalies;

    public TrafficDataGenerator(long seed, double anomalyRate) {
        this.rnd = new Random(seed);
        this.anomalyRate = anomalyRate;
    }

    public TrafficEventEntity generate(Instant timestamp) {
        TrafficProfile profile = TrafficProfile.forHour(timestamp.atZone(ZoneOffset.UTC).getHour());

        int vehicleCount = profile.minVehicles + rnd.nextInt(profile.maxVehicles - profile.minVehicles + 1);
        double avgSpeed = Math.max(MIN_SPEED, profile.speedMean + rnd.nextGaussian() * profile.speedStd);
        double density = uniform(profile.minDensity, profile.maxDensity);
        double minSpeed = Math.max(MIN_SPEED, avgSpeed - uniform(5, 15));
        double maxSpeed = avgSpeed + uniform(10, 25);

        Map<String, Integer> colorCounts = colorCounts(vehicleCount);
        Map<String, Double> interArrivalStats = interArrivalStats(vehicleCount);

        if (rnd.nextDouble() < anomalyRate) {
            injectedAnomalies++;
            switch (InjectedAnomaly.values()[rnd.nextInt(InjectedAnomaly.values().length)]) {
                case HIGH_SPEED -> {
                    avgSpeed *= 1.8;
                    maxSpeed *= 2.0;
                }
                case LOW_SPEED -> {
                    avgSpeed *= 0.3;
                    minSpeed *= 0.2;
                }
                case HIGH_DENSITY -> {
                    vehicleCount = (int) (vehicleCount * 2.5);
                    density = Math.min(1.0, density * 1.5);
                }
                case LOW_DENSITY -> {
                    vehicleCount = Math.max(1, (int) (vehicleCount * 0.3));
                    density *= 0.3;
                }
            }
        }

        Map<String, String> rawFeatures = new LinkedHashMap<>();
        rawFeatures.put("weather", WEATHER[rnd.nextInt(WEATHER.length)]);
        rawFeatures.put("visibility", VISIBILITY[rnd.nextInt(VISIBILITY.length)]);

        TrafficEventEntity trafficEventEntity = new TrafficEventEntity();
        trafficEventEntity.setTimestamp(timestamp);
        trafficEventEntity.setLocationId(LOCATION_IDS.get(rnd.nextInt(LOCATION_IDS.size())));
        trafficEventEntity.setVehicleCount(vehicleCount);
        trafficEventEntity.setAvgSpeed(round(avgSpeed, 100));
        trafficEventEntity.setMinSpeed(round(minSpeed, 100));
        trafficEventEntity.setMaxSpeed(round(maxSpeed, 100));
        trafficEventEntity.setTrafficDensityScore(round(density, 1000));
        trafficEventEntity.setColorCounts(colorCounts);
        trafficEventEntity.setInterArrivalStats(interArrivalStats);
        trafficEventEntity.setRawFeatures(rawFeatures);
        return trafficEventEntity;
    }

    private Map<String, Integer> colorCounts(int vehicleCount) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int remaining = vehicleCount;
        for (int i = 0; i < COLORS.length && remaining > 0; i++) {
            int count = Math.min((int) (vehicleCount * COLOR_SHARES[i] * uniform(0.8, 1.2)), remaining);
            if (count > 0) {
                counts.put(COLORS[i], count);
                remaining -= count;
            }
        }
        return counts;
    }

    // seconds between vehicles, assuming the count spans one hour
    private static Map<String, Double> interArrivalStats(int vehicleCount) {
        double mean = vehicleCount > 0 ? 3600.0 / vehicleCount : 60;
        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("mean", mean);
        stats.put("std", mean * 0.4);
        stats.put("min", Math.max(0.5, mean * 0.2));
        stats.put("max", mean * 2.5);
        return stats;
    }

    private double uniform(double low, double high) {
        return low + (high - low) * rnd.nextDouble();
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
