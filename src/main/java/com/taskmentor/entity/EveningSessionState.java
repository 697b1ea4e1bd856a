package com.taskmentor.entity;

import java.util.Locale;

public enum EveningSessionState {
    STARTING,
    TASK_REVIEW,
    GRATITUDE,
    SUMMARY,
    COMPLETED;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EveningSessionState fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
