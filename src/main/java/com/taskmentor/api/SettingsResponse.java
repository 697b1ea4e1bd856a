package com.taskmentor.api;

import com.taskmentor.entity.NotificationSettings;
import com.taskmentor.entity.TrackerUser;

import java.time.LocalTime;

public record SettingsResponse(
        String userId,
        String timezone,
        boolean enabled,
        boolean dailyDigest,
        boolean deadlineReminders,
        boolean newTaskNotices,
        LocalTime sendTime
) {

    public static SettingsResponse from(TrackerUser user) {
        NotificationSettings settings = user.getNotifications();
        return new SettingsResponse(user.getUserId(), user.getTimezone(), settings.isEnabled(),
                settings.isDailyDigest(), settings.isDeadlineReminders(), settings.isNewTaskNotices(),
                settings.getSendTime());
    }
}
