package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EmotionalPattern {
    PatternType type;
    double significance;                 // 0-1
}
