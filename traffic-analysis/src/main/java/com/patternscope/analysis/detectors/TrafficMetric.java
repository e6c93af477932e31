package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.ObservationDto;

import java.util.function.Function;

/** Metrics scored by every detector, in column order. */
public enum TrafficMetric {
    VEHICLE_COUNT("vehicle_count", true, observation ->
            observation.getVehicleCount() == null ? null : observation.getVehicleCount().doubleValue()),
    AVG_SPEED("avg_speed", false, ObservationDto::getAvgSpeed),
    TRAFFIC_DENSITY_SCORE("traffic_density_score", false, ObservationDto::getTrafficDensityScore);

    private final String metricName;
    private final boolean integral;
    private final Function<ObservationDto, Double> extractor;

    TrafficMetric(String metricName, boolean integral, Function<ObservationDto, Double> extractor) {
        this.metricName = metricName;
        this.integral = integral;
        this.extractor = extractor;
    }

    public String metricName() {
        return metricName;
    }

    /** @return the metric value, or {@code null} when missing or not a finite number */
    public Double valueOf(ObservationDto observation) {
        Double value = extractor.apply(observation);
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return value;
    }

    /** Counts print as whole numbers; measured columns keep their fractional part, so 40.0 stays {@code 40.0}. */
    public String format(double value) {
        if (integral) {
            return Long.toString(Math.round(value));
        }
        return Double.toString(value);
    }
}
