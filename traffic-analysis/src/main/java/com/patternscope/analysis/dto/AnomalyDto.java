package com.patternscope.analysis.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnomalyDto {
    Long id;
    long trafficEventId;
    String anomalyType;
    double confidenceScore;
    List<String> affectedMetrics;
    String description;
    Instant detectedAt;

    public static AnomalyDto from(AnomalyCandidateDto candidate) {
        return AnomalyDto.builder()
                .trafficEventId(candidate.getTrafficEventId())
                .anomalyType(candidate.getAnomalyType())
                .confidenceScore(candidate.getConfidenceScore())
                .affectedMetrics(List.copyOf(candidate.getAffectedMetrics()))
                .description(candidate.getDescription())
                .build();
    }
}
