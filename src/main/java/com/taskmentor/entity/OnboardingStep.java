package com.taskmentor.entity;

import java.util.Locale;

public enum OnboardingStep {
    GREETING,
    ANXIETY_INTRO,
    ANXIETY_SURVEY,
    GOAL_SELECTION,
    NOTIFICATION_SETUP,
    MENTOR_INTRO,
    COMPLETION,
    COMPLETED;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OnboardingStep fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
