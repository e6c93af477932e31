package com.patternscope.analysis.controller;

import com.patternscope.analysis.dto.AnomalyDto;
import com.patternscope.analysis.dto.TrendSuggestionDto;
import com.patternscope.analysis.services.AnomalyQueryService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnomalyController {
    private final AnomalyQueryService anomalyQueryService;

    @GetMapping("/anomalies")
    public List<AnomalyDto> getAnomalies(
            @Parameter(description = "Earliest detection time (ISO-8601)", example = "2024-05-01T00:00:00Z")
            @RequestParam(name = "start", required = false) String start,
            @Parameter(description = "Latest detection time (ISO-8601)", example = "2024-05-02T00:00:00Z")
            @RequestParam(name = "end", required = false) String end) {
        return anomalyQueryService.findRecentAnomalies(start, end);
    }

    @GetMapping("/trends/suggestions")
    public List<TrendSuggestionDto> getSuggestions(
            @RequestParam(name = "start", required = false) String start,
            @RequestParam(name = "end", required = false) String end) {
        return anomalyQueryService.findRecentSuggestions(start, end);
    }
}
