package com.taskmentor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.LocalTime;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationSettings {

    @Builder.Default
    @Column(name = "notifications_enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "daily_digest", nullable = false)
    private boolean dailyDigest;

    @Column(name = "deadline_reminders", nullable = false)
    private boolean deadlineReminders;

    @Column(name = "new_task_notices", nullable = false)
    private boolean newTaskNotices;

    @Builder.Default
    @Column(name = "send_time")
    private LocalTime sendTime = LocalTime.of(9, 0);

    public boolean allows(NotificationType type) {
        if (!enabled) {
            return false;
        }
        return switch (type) {
            case DAILY_DIGEST -> dailyDigest;
            case DEADLINE_REMINDER -> deadlineReminders;
            case NEW_TASK -> newTaskNotices;
        };
    }
}
