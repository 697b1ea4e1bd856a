package com.taskmentor.entity;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Locale;

public enum TrackerGoal {
    TASK_MANAGEMENT("Task management"),
    STRESS_REDUCTION("Stress reduction"),
    PRODUCTIVITY("Productivity"),
    TIME_ORGANIZATION("Time organization");

    private final String label;

    TrackerGoal(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static @Nullable TrackerGoal fromText(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        for (TrackerGoal goal : values()) {
            if (goal.key().equals(normalized)) {
                return goal;
            }
        }
        return null;
    }
}
