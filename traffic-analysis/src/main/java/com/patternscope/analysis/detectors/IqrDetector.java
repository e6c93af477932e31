package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class IqrDetector implements MetricDetector {

    private static final double IQR_MULTIPLIER = 1.5d;
    // distance scoring is undefined once the bounds collapse onto Q1 == Q3
    private static final double COLLAPSED_BOUNDS_CONFIDENCE = 0.5d;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }

    @Override
    public List<AnomalyCandidateDto> detectMetric(TrafficMetric metric, List<MetricSample> samples) {
        double[] sorted = samples.stream().mapToDouble(MetricSample::getValue).sorted().toArray();
        double q1 = Percentiles.percentile(sorted, 25);
        double q3 = Percentiles.percentile(sorted, 75);
        double iqr = q3 - q1;
        double lowerBound = q1 - IQR_MULTIPLIER * iqr;
        double upperBound = q3 + IQR_MULTIPLIER * iqr;

        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (MetricSample sample : samples) {
            double value = sample.getValue();
            if (value >= lowerBound && value <= upperBound) {
                continue;
            }
            double confidence = COLLAPSED_BOUNDS_CONFIDENCE;
            if (iqr > 0) {
                double distance = Math.max(Math.abs(value - lowerBound), Math.abs(value - upperBound));
                confidence = Math.min(distance / (IQR_MULTIPLIER * iqr), 1.0);
            }
            candidates.add(AnomalyCandidateDto.builder()
                    .trafficEventId(sample.getTrafficEventId())
                    .anomalyType(method().wireName())
                    .confidenceScore(confidence)
                    .affectedMetrics(List.of(metric.metricName()))
                    .description(String.format(Locale.ROOT, "%s value %s is outside IQR bounds [%.2f, %.2f]",
                            metric.metricName(), metric.format(value), lowerBound, upperBound))
                    .build());
        }
        return candidates;
    }
}
