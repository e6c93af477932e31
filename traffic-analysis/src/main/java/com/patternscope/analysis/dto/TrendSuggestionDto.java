package com.patternscope.analysis.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class TrendSuggestionDto {
    private Long id;
    private Instant createdAt;
    private Instant timePeriodStart;
    private Instant timePeriodEnd;
    private String suggestionType;
    private double confidenceLevel;
    private String description;
    private List<Long> relatedAnomalies;
    private String actionTaken;
}
