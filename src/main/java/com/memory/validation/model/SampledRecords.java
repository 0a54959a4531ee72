package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Records picked for human spot-check validation, with their coverage")
public class SampledRecords {

    List<MemoryRecord> samples;
    CoverageAnalysis coverage;

    @Schema(description = "Records the sample was drawn from", example = "1200")
    int populationSize;

    @Schema(description = "Records in the sample", example = "120")
    int sampleSize;

    @Schema(description = "sampleSize / populationSize", example = "0.1")
    double samplingRate;

    @Schema(description = "Name of the strategy used", example = "balanced-stratified-sampling")
    String strategy;

    @Schema(description = "Seed the shuffle used; replaying it reproduces the sample", example = "42")
    long seed;

    @Schema(description = "Sampling timestamp, epoch milliseconds")
    long sampledAt;
}
