package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "How a validation sample is drawn from a set of records")
public class SamplingStrategy {

    @Schema(description = "Strategy name", example = "balanced-stratified-sampling")
    String name;

    @Schema(description = "Records wanted in the sample, capped at the population size", example = "100")
    int targetSize;

    @Schema(description = "Stratify by emotional trajectory")
    boolean byEmotion;

    @Schema(description = "Stratify by calendar month of the record timestamp (UTC)")
    boolean byTimePeriod;

    @Schema(description = "Stratify by relationship support level")
    boolean byRelationship;

    @Schema(description = "Stratify by extraction-confidence band")
    boolean byQuality;

    @Schema(description = "Shuffle seed; a fresh one is drawn when omitted", example = "42")
    Long seed;

    @Schema(description = "Coverage score this strategy is expected to reach", example = "0.85")
    double expectedCoverage;

    public boolean isStratified() {
        return byEmotion || byTimePeriod || byRelationship || byQuality;
    }
}
