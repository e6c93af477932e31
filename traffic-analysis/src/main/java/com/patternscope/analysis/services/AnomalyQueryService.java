package com.patternscope.analysis.services;

import com.patternscope.analysis.dto.AnomalyDto;
import com.patternscope.analysis.dto.TrendSuggestionDto;
import com.patternscope.analysis.model.entities.AnomalyEntity;
import com.patternscope.analysis.model.entities.TrendSuggestionEntity;
import com.patternscope.analysis.repositories.AnomalyRepository;
import com.patternscope.analysis.repositories.TrendSuggestionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
public class AnomalyQueryService {

    static final int ANOMALY_LIMIT = 100;
    static final int SUGGESTION_LIMIT = 50;

    private final AnomalyRepository anomalyRepository;
    private final TrendSuggestionRepository trendSuggestionRepository;

    @Transactional(readOnly = true)
    public List<AnomalyDto> findRecentAnomalies(String start, String end) {
        AnalysisPeriod period = AnalysisPeriod.parse(start, end);
        List<AnomalyDto> anomalyDtos = new ArrayList<>();
        try (Stream<AnomalyEntity> anomalyStream = anomalyRepository.findDetectedBetween(
                lowerBound(period), upperBound(period), PageRequest.of(0, ANOMALY_LIMIT))) {
            anomalyStream.forEach(anomaly -> anomalyDtos.add(AnomalyDto.builder()
                    .id(anomaly.getId())
                    .trafficEventId(anomaly.getTrafficEventId())
                    .anomalyType(anomaly.getAnomalyType())
                    .confidenceScore(anomaly.getConfidenceScore())
                    .affectedMetrics(anomaly.getAffectedMetrics() == null ? List.of() : List.copyOf(anomaly.getAffectedMetrics()))
                    .description(anomaly.getDescription())
                    .detectedAt(anomaly.getDetectedAt())
                    .build()));
        }
        return anomalyDtos;
    }

    @Transactional(readOnly = true)
    public List<TrendSuggestionDto> findRecentSuggestions(String start, String end) {
        AnalysisPeriod period = AnalysisPeriod.parse(start, end);
        List<TrendSuggestionDto> suggestionDtos = new ArrayList<>();
        try (Stream<TrendSuggestionEntity> suggestionStream = trendSuggestionRepository.findCreatedBetween(
                lowerBound(period), upperBound(period), PageRequest.of(0, SUGGESTION_LIMIT))) {
            suggestionStream.forEach(suggestion -> suggestionDtos.add(TrendSuggestionDto.builder()
                    .id(suggestion.getId())
                    .createdAt(suggestion.getCreatedAt())
                    .timePeriodStart(suggestion.getTimePeriodStart())
                    .timePeriodEnd(suggestion.getTimePeriodEnd())
                    .suggestionType(suggestion.getSuggestionType())
                    .confidenceLevel(suggestion.getConfidenceLevel())
                    .description(suggestion.getDescription())
                    .relatedAnomalies(suggestion.getRelatedAnomalies())
                    .actionTaken(suggestion.getActionTaken())
                    .build()));
        }
        return suggestionDtos;
    }

    private static Instant lowerBound(AnalysisPeriod period) {
        return period.getStart() != null ? period.getStart() : Instant.EPOCH;
    }

    // far enough ahead for any stored row, still representable as a SQL timestamp
    private static Instant upperBound(AnalysisPeriod period) {
        return period.getEnd() != null ? period.getEnd() : Instant.parse("9999-12-31T23:59:59Z");
    }
}
