package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ReviewQueueEntry {
    int rank;                // 1 = review first
    ReviewBucket bucket;
    double urgency;
    double blendedScore;
    ValidationDecision decision;
}
