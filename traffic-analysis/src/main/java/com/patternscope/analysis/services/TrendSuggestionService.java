package com.patternscope.analysis.services;

import com.patternscope.analysis.client.OllamaClient;
import com.patternscope.analysis.dto.AnomalyDto;
import com.patternscope.analysis.dto.TrendSuggestionDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a consolidated anomaly list into a natural-language trend suggestion. Generation
 * failures never propagate: the caller receives a generic fallback suggestion instead.
 */
@Slf4j
@Service
public class TrendSuggestionService {

    static final String SUGGESTION_TYPE = "anomaly_summary";
    static final double GENERATED_CONFIDENCE = 0.8;
    static final double FALLBACK_CONFIDENCE = 0.5;
    private static final int MAX_RELATED_ANOMALIES = 10;
    private static final DateTimeFormatter PROMPT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final OllamaClient ollamaClient;
    private final TrafficDataStore trafficDataStore;
    private final boolean llmEnabled;

    public TrendSuggestionService(OllamaClient ollamaClient,
                                  TrafficDataStore trafficDataStore,
                                  @Value("${llm.enabled:true}") boolean llmEnabled) {
        this.ollamaClient = ollamaClient;
        this.trafficDataStore = trafficDataStore;
        this.llmEnabled = llmEnabled;
    }

    public List<TrendSuggestionDto> generateSuggestions(List<AnomalyDto> anomalies, Instant start, Instant end) {
        if (anomalies == null || anomalies.isEmpty()) {
            return List.of();
        }
        List<Long> related = anomalies.stream()
                .limit(MAX_RELATED_ANOMALIES)
                .map(AnomalyDto::getTrafficEventId)
                .toList();
        try {
            String text = llmEnabled ? ollamaClient.generate(buildPrompt(anomalies, start, end)) : cannedSummary(anomalies.size());
            TrendSuggestionDto suggestion = TrendSuggestionDto.builder()
                    .timePeriodStart(start)
                    .timePeriodEnd(end)
                    .suggestionType(SUGGESTION_TYPE)
                    .confidenceLevel(GENERATED_CONFIDENCE)
                    .description(text)
                    .relatedAnomalies(related)
                    .build();
            suggestion.setId(trafficDataStore.persistSuggestion(suggestion));
            return List.of(suggestion);
        } catch (Exception ex) {
            log.warn("Trend suggestion generation failed, using fallback", ex);
            return List.of(TrendSuggestionDto.builder()
                    .timePeriodStart(start)
                    .timePeriodEnd(end)
                    .suggestionType(SUGGESTION_TYPE)
                    .confidenceLevel(FALLBACK_CONFIDENCE)
                    .description(fallbackSummary(anomalies.size()))
                    .relatedAnomalies(related)
                    .build());
        }
    }

    String buildPrompt(List<AnomalyDto> anomalies, Instant start, Instant end) {
        String period = "";
        if (start != null && end != null) {
            period = "from " + PROMPT_TIME.format(start) + " to " + PROMPT_TIME.format(end);
        } else if (start != null) {
            period = "since " + PROMPT_TIME.format(start);
        } else if (end != null) {
            period = "until " + PROMPT_TIME.format(end);
        }

        Map<String, Long> byType = anomalies.stream()
                .collect(Collectors.groupingBy(AnomalyDto::getAnomalyType, LinkedHashMap::new, Collectors.counting()));
        String summary = byType.entrySet().stream()
                .map(entry -> "- " + entry.getValue() + " anomalies detected using " + entry.getKey() + " method")
                .collect(Collectors.joining("\n"));

        return "Analyze the following traffic anomalies " + period + " and provide actionable insights:\n\n"
                + summary + "\n\n"
                + "Total anomalies detected: " + anomalies.size() + "\n\n"
                + "Based on these anomalies, provide 3-5 bullet-point suggestions for traffic management. Focus on:\n"
                + "1. Potential causes of the anomalies\n"
                + "2. Safety concerns\n"
                + "3. Recommended actions\n\n"
                + "Keep each bullet point concise (1-2 sentences).\n";
    }

    static String fallbackSummary(int anomalyCount) {
        return "Detected " + anomalyCount + " anomalies in traffic patterns. Manual review recommended.";
    }

    static String cannedSummary(int anomalyCount) {
        return "Based on the analysis of " + anomalyCount + " traffic anomalies:\n\n"
                + "- Unusual traffic patterns detected, consider investigating potential incidents or events\n"
                + "- Speed variations suggest possible congestion or road conditions requiring attention\n"
                + "- Monitor these patterns for recurring issues during similar time periods\n"
                + "- Consider adjusting traffic signal timing if anomalies persist\n"
                + "- Review footage or sensor data for the affected time periods\n";
    }
}
