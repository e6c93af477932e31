package com.patternscope.analysis.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A single detector's claim that one traffic event is anomalous.
 */
@Value
@Builder
public class AnomalyCandidateDto {
    long trafficEventId;
    String anomalyType;
    double confidenceScore;
    List<String> affectedMetrics;
    String description;
}
