package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;
import com.patternscope.analysis.dto.AnomalyDto;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one anomaly per traffic event: the candidate with the strictly highest confidence.
 * On an exact tie the first candidate seen wins.
 */
@Component
public class AnomalyConsolidator {

    public List<AnomalyDto> consolidate(List<AnomalyCandidateDto> candidates) {
        Map<Long, AnomalyCandidateDto> best = new LinkedHashMap<>();
        for (AnomalyCandidateDto candidate : candidates) {
            best.merge(candidate.getTrafficEventId(), candidate,
                    (current, challenger) -> challenger.getConfidenceScore() > current.getConfidenceScore() ? challenger : current);
        }
        List<AnomalyDto> anomalies = new ArrayList<>(best.size());
        best.values().forEach(candidate -> anomalies.add(AnomalyDto.from(candidate)));
        return anomalies;
    }
}
