package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchError {
    int index;               // position of the record in the submitted batch
    String recordId;         // null when the record itself was missing
    String message;
}
