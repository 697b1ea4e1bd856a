package com.taskmentor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "daily_summary",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_summary_owner_date",
                columnNames = {"owner_id", "summary_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySummary {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "summary_date", nullable = false)
    private LocalDate summaryDate;

    @Column(name = "tasks_reviewed", nullable = false)
    private int tasksReviewed;

    @Column(name = "tasks_with_progress", nullable = false)
    private int tasksWithProgress;

    @Column(name = "tasks_needing_help", nullable = false)
    private int tasksNeedingHelp;

    @Column(name = "gratitude_theme", length = 100)
    private String gratitudeTheme;

    @Enumerated(EnumType.STRING)
    @Column(name = "productivity_level", nullable = false, length = 10)
    private ProductivityLevel productivityLevel;

    @Column(name = "summary_text", columnDefinition = "TEXT")
    private String summaryText;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
