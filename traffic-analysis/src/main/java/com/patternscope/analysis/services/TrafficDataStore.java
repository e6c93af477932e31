package com.patternscope.analysis.services;

import com.patternscope.analysis.dto.AnomalyDto;
import com.patternscope.analysis.dto.ObservationDto;
import com.patternscope.analysis.dto.TrendSuggestionDto;
import com.patternscope.analysis.model.entities.AnomalyEntity;
import com.patternscope.analysis.model.entities.TrafficEventEntity;
import com.patternscope.analysis.model.entities.TrendSuggestionEntity;
import com.patternscope.analysis.repositories.AnomalyRepository;
import com.patternscope.analysis.repositories.TrafficEventRepository;
import com.patternscope.analysis.repositories.TrendSuggestionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads traffic observations and records anomalies and trend suggestions.
 * Data access failures surface as Spring {@code DataAccessException}s and are never retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrafficDataStore {

    private final TrafficEventRepository trafficEventRepository;
    private final AnomalyRepository anomalyRepository;
    private final TrendSuggestionRepository trendSuggestionRepository;

    /**
     * @param start inclusive lower bound, {@code null} for unbounded
     * @param end   inclusive upper bound, {@code null} for unbounded
     * @return observations ordered by timestamp ascending, possibly empty
     */
    @Transactional(readOnly = true)
    public List<ObservationDto> fetchObservations(Instant start, Instant end) {
        List<TrafficEventEntity> events;
        if (start != null && end != null) {
            events = trafficEventRepository.findAllByTimestampBetweenOrderByTimestampAsc(start, end);
        } else if (start != null) {
            events = trafficEventRepository.findAllByTimestampGreaterThanEqualOrderByTimestampAsc(start);
        } else if (end != null) {
            events = trafficEventRepository.findAllByTimestampLessThanEqualOrderByTimestampAsc(end);
        } else {
            events = trafficEventRepository.findAllByOrderByTimestampAsc();
        }
        log.info("Fetched {} traffic events for period [{} , {}]", events.size(), start, end);
        return events.stream().map(TrafficDataStore::toObservation).toList();
    }

    @Transactional
    public int persistAnomalies(List<AnomalyDto> anomalies) {
        if (anomalies.isEmpty()) {
            return 0;
        }
        List<AnomalyEntity> entities = new ArrayList<>(anomalies.size());
        for (AnomalyDto anomaly : anomalies) {
            AnomalyEntity anomalyEntity = new AnomalyEntity();
            anomalyEntity.setTrafficEventId(anomaly.getTrafficEventId());
            anomalyEntity.setAnomalyType(anomaly.getAnomalyType());
            anomalyEntity.setConfidenceScore(anomaly.getConfidenceScore());
            anomalyEntity.setAffectedMetrics(new ArrayList<>(anomaly.getAffectedMetrics()));
            anomalyEntity.setDescription(anomaly.getDescription());
            entities.add(anomalyEntity);
        }
        int written = anomalyRepository.saveAll(entities).size();
        log.info("Persisted {} anomalies", written);
        return written;
    }

    @Transactional
    public Long persistSuggestion(TrendSuggestionDto suggestion) {
        TrendSuggestionEntity trendSuggestionEntity = new TrendSuggestionEntity();
        trendSuggestionEntity.setTimePeriodStart(suggestion.getTimePeriodStart());
        trendSuggestionEntity.setTimePeriodEnd(suggestion.getTimePeriodEnd());
        trendSuggestionEntity.setSuggestionType(suggestion.getSuggestionType());
        trendSuggestionEntity.setConfidenceLevel(suggestion.getConfidenceLevel());
        trendSuggestionEntity.setDescription(suggestion.getDescription());
        trendSuggestionEntity.setRelatedAnomalies(suggestion.getRelatedAnomalies() == null
                ? List.of() : new ArrayList<>(suggestion.getRelatedAnomalies()));
        TrendSuggestionEntity saved = trendSuggestionRepository.save(trendSuggestionEntity);
        return saved.getId();
    }

    static ObservationDto toObservation(TrafficEventEntity entity) {
        return ObservationDto.builder()
                .id(entity.getId())
                .timestamp(entity.getTimestamp())
                .locationId(entity.getLocationId())
                .vehicleCount(entity.getVehicleCount())
                .avgSpeed(entity.getAvgSpeed())
                .minSpeed(entity.getMinSpeed())
                .maxSpeed(entity.getMaxSpeed())
                .trafficDensityScore(entity.getTrafficDensityScore())
                .build();
    }
}
