package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DistributionCheck {
    boolean flagged;
    boolean evaluated;                               // false when the batch was too small to judge
    Map<ValidationOutcome, Double> observedRatios;
    double errorRate;
    List<String> findings;
}
