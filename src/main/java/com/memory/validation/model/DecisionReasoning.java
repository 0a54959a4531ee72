package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DecisionReasoning {
    ConfidenceFactor primaryDriver;
    List<ConfidenceFactor> uncertaintyAreas;
    List<ConfidenceFactor> strengths;
    String summary;
}
