package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QualityAlert {
    AlertType type;
    AlertSeverity severity;
    String message;
    String recommendedAction;
    double observed;
    double limit;
}
