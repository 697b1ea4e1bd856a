package com.taskmentor.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProductivityLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
