package com.patternscope.analysis.detectors;

import com.patternscope.analysis.dto.ObservationDto;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only input shared by all detectors of one analysis run.
 */
@Value
@Builder
public class DetectionContext {
    List<ObservationDto> observations;
    long seed;
}
