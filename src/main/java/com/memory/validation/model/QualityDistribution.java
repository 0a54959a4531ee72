package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of records or decisions per confidence band: high (&ge; 0.8), medium (&ge; 0.5), low.
 */
@Value
@Builder
public class QualityDistribution {
    int high;
    int medium;
    int low;

    public int total() {
        return high + medium + low;
    }
}
