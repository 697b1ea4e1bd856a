package com.taskmentor.api;

import java.time.LocalTime;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateSettingsRequest(
        String timezone,
        Boolean enabled,
        Boolean dailyDigest,
        Boolean deadlineReminders,
        Boolean newTaskNotices,
        LocalTime sendTime
) {
}
