package com.taskmentor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "evening_session",
        uniqueConstraints = @UniqueConstraint(name = "uk_evening_session_owner_date",
                columnNames = {"owner_id", "session_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EveningSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private EveningSessionState state;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "evening_session_review", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "list_index")
    @Builder.Default
    private List<TaskReviewItem> reviewItems = new ArrayList<>();

    @Column(name = "current_index", nullable = false)
    private int currentIndex;

    @Column(name = "gratitude", columnDefinition = "TEXT")
    private String gratitude;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "evening_session_transcript", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "list_index")
    @Builder.Default
    private List<DialogueTurn> transcript = new ArrayList<>();

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public TaskReviewItem currentItem() {
        return reviewItems.get(currentIndex);
    }
}
