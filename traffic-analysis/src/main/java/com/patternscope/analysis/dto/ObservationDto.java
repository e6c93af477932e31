package com.patternscope.analysis.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One traffic sensor reading. Any metric may be {@code null} when the sensor did not report it.
 */
@Value
@Builder
public class ObservationDto {
    long id;
    Instant timestamp;
    Integer locationId;
    Integer vehicleCount;
    Double avgSpeed;
    Double minSpeed;
    Double maxSpeed;
    Double trafficDensityScore;
}
