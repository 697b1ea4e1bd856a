package com.taskmentor.tracker.notification;

import com.taskmentor.completion.CompletionMetricsService;
import com.taskmentor.entity.OnboardingStep;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.repository.TrackerUserRepository;
import com.taskmentor.tracker.ConversationContextService;
import com.taskmentor.tracker.UserLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Deployment-wide timers for the daily digest and the deadline sweep. Every per-user job runs
 * under that user's conversation lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationScheduler {

    private final TrackerUserRepository userRepository;
    private final NotificationService notificationService;
    private final ConversationContextService contextService;
    private final UserLockRegistry lockRegistry;
    private final CompletionMetricsService metricsService;
    private final Clock clock;

    @Scheduled(cron = "${taskmentor.notifications.digest-cron:0 0 9 * * *}",
            zone = "${taskmentor.notifications.zone:UTC}")
    public void runDailyDigest() {
        List<TrackerUser> users = userRepository.findByOnboardingStep(OnboardingStep.COMPLETED);
        int sent = 0;
        for (TrackerUser user : users) {
            try {
                boolean delivered = lockRegistry.withLock(user.getUserId(),
                        () -> notificationService.sendDailyDigest(user.getUserId(), contextService.today(user)));
                if (delivered) {
                    sent++;
                }
            } catch (Exception e) {
                log.error("Error sending daily digest to user {}", user.getUserId(), e);
            }
        }
        log.info("Daily digest run finished: {} of {} users notified", sent, users.size());
        metricsService.logSummary();
    }

    @Scheduled(fixedDelayString = "${taskmentor.notifications.deadline-sweep-interval:PT2H}",
            initialDelayString = "PT1M")
    public void runDeadlineSweep() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (TrackerUser user : userRepository.findByOnboardingStep(OnboardingStep.COMPLETED)) {
            try {
                lockRegistry.runLocked(user.getUserId(),
                        () -> notificationService.sendDeadlineReminders(user.getUserId(), now));
            } catch (Exception e) {
                log.error("Error sending deadline reminder to user {}", user.getUserId(), e);
            }
        }
    }
}
