package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.AnomalyCandidateDto;

import java.util.List;

/**
 * One detection method. Implementations hold no mutable state and may run concurrently
 * over the same {@link DetectionContext}.
 */
public interface AnomalyDetector {

    DetectionMethod method();

    /**
     * Returns the candidates found in the batch. An empty list means the method abstained
     * or found nothing; abstention is never reported as an error.
     */
    List<AnomalyCandidateDto> detect(DetectionContext context);
}
