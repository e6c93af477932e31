package com.patternscope.analysis.controller;

import com.patternscope.analysis.dto.AnalysisRequestDto;
import com.patternscope.analysis.dto.AnalysisResultDto;
import com.patternscope.analysis.services.AnalysisPeriod;
import com.patternscope.analysis.services.AnalysisService;
import com.patternscope.analysis.services.TrendSuggestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {
    private final AnalysisService analysisService;
    private final TrendSuggestionService trendSuggestionService;

    @PostMapping("/run")
    public AnalysisResultDto runAnalysis(@RequestBody(required = false) AnalysisRequestDto req) {
        AnalysisRequestDto request = req != null ? req : new AnalysisRequestDto();
        AnalysisResultDto result = analysisService.runAnalysis(request);
        if (result.getAnomaliesDetected() > 0) {
            AnalysisPeriod period = AnalysisPeriod.parse(request.getStart(), request.getEnd());
            result.setSuggestions(trendSuggestionService.generateSuggestions(
                    result.getAnomalyDetails(), period.getStart(), period.getEnd()));
        }
        return result;
    }
}
