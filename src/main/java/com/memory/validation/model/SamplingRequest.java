package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Records to draw a validation sample from")
public class SamplingRequest {

    @Singular
    @Schema(description = "Population to sample")
    List<MemoryRecord> records;

    @Schema(description = "Sample size; a strategy is recommended from the records when omitted", example = "100")
    Integer targetSize;

    @Schema(description = "Shuffle seed for a reproducible sample", example = "42")
    Long seed;
}
