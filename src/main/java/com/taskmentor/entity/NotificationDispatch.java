package com.taskmentor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Last-sent marker for a scheduled notification. The key identifies what was sent: the
 * user-local date for digests, {@code taskId@dueAt} for deadline reminders.
 */
@Entity
@Table(name = "notification_dispatch",
        uniqueConstraints = @UniqueConstraint(name = "uk_notification_dispatch",
                columnNames = {"owner_id", "type", "dispatch_key"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationDispatch {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private NotificationType type;

    @Column(name = "dispatch_key", nullable = false, length = 120)
    private String dispatchKey;

    @Column(name = "sent_at", nullable = false)
    private OffsetDateTime sentAt;
}
