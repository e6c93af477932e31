package com.patternscope.analysis.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AnalysisResultDto {

    private boolean success;
    private int anomaliesDetected;
    private List<AnomalyDto> anomalyDetails;
    private PeriodDto period;
    private List<String> methodsUsed;
    private String message;
    private List<TrendSuggestionDto> suggestions;
}
