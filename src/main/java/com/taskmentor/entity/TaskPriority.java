package com.taskmentor.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Locale;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static @Nullable TaskPriority fromValue(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TaskPriority priority : values()) {
            if (priority.name().equals(normalized)) {
                return priority;
            }
        }
        return null;
    }

    public boolean isElevated() {
        return this == HIGH || this == URGENT;
    }
}
