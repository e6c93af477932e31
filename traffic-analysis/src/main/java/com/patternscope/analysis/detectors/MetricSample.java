package com.patternscope.analysis.detectors;

import lombok.Value;

@Value
public class MetricSample {
    long trafficEventId;
    double value;
}
