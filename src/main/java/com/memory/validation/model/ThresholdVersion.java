package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThresholdVersion {
    long version;
    ThresholdConfig config;
    ConfigSource source;
    String reason;
    long activatedAt;
}
