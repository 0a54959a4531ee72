package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConfidenceBucket {
    String range;            // e.g. "60-80%"
    int count;
    double accuracy;
    double averageConfidence;
}
