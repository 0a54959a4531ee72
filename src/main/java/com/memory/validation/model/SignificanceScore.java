package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SignificanceScore {

    public static final double MAX_ADJUSTMENT = 0.2;

    double value;                    // 0-10
    SignificanceFactors factors;
    double thresholdAdjustment;      // signed, within [-MAX_ADJUSTMENT, +MAX_ADJUSTMENT]
}
