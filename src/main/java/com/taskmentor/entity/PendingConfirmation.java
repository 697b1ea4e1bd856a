package com.taskmentor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A single task action surfaced to the user and waiting for an affirmative reply.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingConfirmation {

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_action", length = 30)
    private ConfirmationAction action;

    @Column(name = "pending_task_id")
    private UUID taskId;

    @Column(name = "pending_task_title", length = 500)
    private String taskTitle;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_target_status", length = 20)
    private TaskStatus targetStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_target_priority", length = 20)
    private TaskPriority targetPriority;

    @Column(name = "pending_surfaced_at")
    private OffsetDateTime surfacedAt;

    public boolean isExpired(OffsetDateTime now, Duration window) {
        return surfacedAt == null || surfacedAt.plus(window).isBefore(now);
    }
}
