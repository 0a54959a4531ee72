package com.memory.validation.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class EmotionalAnalysis {
    double moodScore;                    // 0-10, 5 is neutral
    TrajectoryDirection trajectory;
    @Singular
    List<EmotionalPattern> patterns;
}
