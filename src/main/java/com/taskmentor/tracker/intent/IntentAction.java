package com.taskmentor.tracker.intent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IntentAction {
    CREATE,
    UPDATE,
    DELETE,
    VIEW,
    STATS,
    REFLECT,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntentAction fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (IntentAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        return UNKNOWN;
    }

    public boolean targetsExistingTask() {
        return this == UPDATE || this == DELETE;
    }
}
