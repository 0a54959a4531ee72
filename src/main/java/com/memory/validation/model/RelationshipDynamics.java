package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RelationshipDynamics {
    DynamicsLevel intimacyLevel;
    DynamicsLevel conflictLevel;
    SupportLevel supportLevel;
}
