package com.taskmentor.entity;

import org.springframework.lang.Nullable;

import java.util.Locale;

public enum NotificationType {
    DAILY_DIGEST("daily_digest"),
    DEADLINE_REMINDER("deadline_reminders"),
    NEW_TASK("new_task_notices");

    private final String settingKey;

    NotificationType(String settingKey) {
        this.settingKey = settingKey;
    }

    public String settingKey() {
        return settingKey;
    }

    public static @Nullable NotificationType fromSettingKey(@Nullable String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (NotificationType type : values()) {
            if (type.settingKey.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
