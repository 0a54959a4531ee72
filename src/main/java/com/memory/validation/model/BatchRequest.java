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
@Schema(description = "A batch of memory records to validate together")
public class BatchRequest {

    @Singular
    @Schema(description = "Records to validate")
    List<MemoryRecord> records;

    @Schema(description = "Records per second the caller wants; sizes the worker count. Server default when omitted",
            example = "1000")
    Integer targetThroughput;
}
