package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Sub-factors of the significance score, each on the 0-10 scale.
 */
@Value
@Builder
public class SignificanceFactors {
    double moodMagnitude;
    double relationshipImpact;
    double psychologicalMarkers;
    double turningPointPotential;
}
