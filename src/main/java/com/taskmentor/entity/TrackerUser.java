package com.taskmentor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "tracker_user")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackerUser {

    @Id
    @Column(name = "user_id", length = 100)
    private String userId;

    @Builder.Default
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone = "UTC";

    @Embedded
    @Builder.Default
    private NotificationSettings notifications = new NotificationSettings();

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(name = "current_view", nullable = false, length = 20)
    private UserView currentView = UserView.ONBOARDING;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(name = "onboarding_step", nullable = false, length = 30)
    private OnboardingStep onboardingStep = OnboardingStep.GREETING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracker_user_anxiety_answer", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "score", nullable = false)
    @Builder.Default
    private List<Integer> anxietyAnswers = new ArrayList<>();

    @Column(name = "anxiety_level")
    private Double anxietyLevel;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracker_user_goal", joinColumns = @JoinColumn(name = "user_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "goal", nullable = false, length = 30)
    @Builder.Default
    private Set<TrackerGoal> goals = EnumSet.noneOf(TrackerGoal.class);

    @Column(name = "met_mentor", nullable = false)
    private boolean metMentor;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracker_user_dialogue", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "list_index")
    @Builder.Default
    private List<DialogueTurn> recentDialogue = new ArrayList<>();

    @Embedded
    private PendingConfirmation pendingConfirmation;

    @Column(name = "last_message_id", length = 100)
    private String lastMessageId;

    @Column(name = "last_reply", columnDefinition = "TEXT")
    private String lastReply;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public boolean isOnboardingComplete() {
        return onboardingStep == OnboardingStep.COMPLETED;
    }
}
