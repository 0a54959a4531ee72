package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SamplingEffectiveness {
    int samplesConsidered;
    double averageCoverage;
    double samplingEfficiency;
    double representativenessScore;
    List<String> recommendations;
}
