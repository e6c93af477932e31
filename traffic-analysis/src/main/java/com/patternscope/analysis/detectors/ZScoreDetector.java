package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
public class ZScoreDetector implements MetricDetector {

    private final double threshold;

    public ZScoreDetector(@Value("${analysis.zscore.threshold:3.0}") double threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("z-score threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public List<AnomalyCandidateDto> detectMetric(TrafficMetric metric, List<MetricSample> samples) {
        if (samples.size() < 2) {
            log.debug("z-score: {} has {} value(s), skipping", metric.metricName(), samples.size());
            return List.of();
        }
        double[] values = samples.stream().mapToDouble(MetricSample::getValue).toArray();
        double mean = MathEx.mean(values);
        double std = MathEx.sd(values);
        if (std == 0 || Double.isNaN(std)) {
            log.debug("z-score: {} has zero deviation, skipping", metric.metricName());
            return List.of();
        }

        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (MetricSample sample : samples) {
            double z = Math.abs(sample.getValue() - mean) / std;
            if (z > threshold) {
                candidates.add(AnomalyCandidateDto.builder()
                        .trafficEventId(sample.getTrafficEventId())
                        .anomalyType(method().wireName())
                        .confidenceScore(Math.min(z / threshold, 1.0))
                        .affectedMetrics(List.of(metric.metricName()))
                        .description(String.format(Locale.ROOT, "%s value %s is %.2f standard deviations from mean",
                                metric.metricName(), metric.format(sample.getValue()), z))
                        .build());
            }
        }
        return candidates;
    }
}
