package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import com.patternscope.analysis.dto.ObservationDto;

import java.util.ArrayList;
import java.util.List;

/**
 * Univariate rule applied to each {@link TrafficMetric} independently. Metrics with no
 * present value in the batch are skipped before the rule sees them.
 */
public interface MetricDetector extends AnomalyDetector {

    List<AnomalyCandidateDto> detectMetric(TrafficMetric metric, List<MetricSample> samples);

    @Override
    default List<AnomalyCandidateDto> detect(DetectionContext context) {
        List<AnomalyCandidateDto> candidates = new ArrayList<>();
        for (TrafficMetric metric : TrafficMetric.values()) {
            List<MetricSample> samples = new ArrayList<>();
            for (ObservationDto observation : context.getObservations()) {
                Double value = metric.valueOf(observation);
                if (value != null) {
                    samples.add(new MetricSample(observation.getId(), value));
                }
            }
            if (!samples.isEmpty()) {
                candidates.addAll(detectMetric(metric, samples));
            }
        }
        return candidates;
    }
}
