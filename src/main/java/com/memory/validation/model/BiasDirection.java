package com.memory.validation.model;

public enum BiasDirection {
    NONE,
    OVERCONFIDENT,
    UNDERCONFIDENT
}
