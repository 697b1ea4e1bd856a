package com.taskmentor.tracker.notification;

import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.NotificationDispatch;
import com.taskmentor.entity.NotificationType;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.repository.NotificationDispatchRepository;
import com.taskmentor.repository.TaskRepository;
import com.taskmentor.repository.TrackerUserRepository;
import com.taskmentor.tracker.ChatTransport;
import com.taskmentor.tracker.task.TaskFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Builds and delivers digests, deadline reminders and new-task notices. Scheduled sends are
 * idempotent through {@link NotificationDispatch} markers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final TaskRepository taskRepository;
    private final TrackerUserRepository userRepository;
    private final NotificationDispatchRepository dispatchRepository;
    private final ChatTransport chatTransport;
    private final TaskFormatter taskFormatter;
    private final TaskMentorProperties properties;
    private final Clock clock;

    /**
     * Sends the digest for {@code date} unless one was already sent for that user and date.
     *
     * @return whether a digest was delivered by this call
     */
    public boolean sendDailyDigest(String userId, LocalDate date) {
        Optional<TrackerUser> user = eligibleUser(userId, NotificationType.DAILY_DIGEST);
        if (user.isEmpty()) {
            return false;
        }
        String key = date.toString();
        if (dispatchRepository.existsByOwnerIdAndTypeAndDispatchKey(userId, NotificationType.DAILY_DIGEST, key)) {
            log.debug("Daily digest for {} on {} already sent", userId, key);
            return false;
        }
        String text = buildDigest(userId, OffsetDateTime.now(clock));
        chatTransport.notify(userId, NotificationType.DAILY_DIGEST, text);
        markSent(userId, NotificationType.DAILY_DIGEST, key);
        log.info("Daily digest sent to user {}", userId);
        return true;
    }

    /**
     * Reminds the user of active tasks due within the configured horizon. Each task and due time
     * pair is reminded at most once.
     *
     * @return number of tasks newly reminded
     */
    public int sendDeadlineReminders(String userId, OffsetDateTime now) {
        Optional<TrackerUser> user = eligibleUser(userId, NotificationType.DEADLINE_REMINDER);
        if (user.isEmpty()) {
            return 0;
        }
        TaskMentorProperties.NotificationConfig config = properties.getNotifications();
        List<Task> upcoming = taskRepository.findByOwnerIdAndStatusInAndDueAtLessThanEqualOrderByDueAtAsc(userId,
                EnumSet.of(TaskStatus.PENDING, TaskStatus.IN_PROGRESS), now.plus(config.getDeadlineHorizon()));
        List<Task> fresh = new ArrayList<>();
        for (Task task : upcoming) {
            if (!dispatchRepository.existsByOwnerIdAndTypeAndDispatchKey(userId, NotificationType.DEADLINE_REMINDER,
                    deadlineKey(task))) {
                fresh.add(task);
            }
        }
        if (fresh.isEmpty()) {
            return 0;
        }
        chatTransport.notify(userId, NotificationType.DEADLINE_REMINDER, buildDeadlineReminder(fresh, now));
        fresh.forEach(task -> markSent(userId, NotificationType.DEADLINE_REMINDER, deadlineKey(task)));
        log.info("Deadline reminder for {} tasks sent to user {}", fresh.size(), userId);
        return fresh.size();
    }

    /**
     * Never throws: the task is already stored when this runs.
     */
    public boolean notifyNewTask(String ownerId, Task task) {
        try {
            Optional<TrackerUser> user = userRepository.findById(ownerId);
            if (user.isEmpty() || !user.get().getNotifications().allows(NotificationType.NEW_TASK)) {
                return false;
            }
            chatTransport.notify(ownerId, NotificationType.NEW_TASK,
                    "New task created\n\n" + task.getTitle() + "\n\nGood luck with it!");
            log.info("New task notification sent to user {}", ownerId);
            return true;
        } catch (RuntimeException ex) {
            log.error("Error sending new task notification to user {}", ownerId, ex);
            return false;
        }
    }

    String buildDigest(String userId, OffsetDateTime now) {
        TaskMentorProperties.NotificationConfig config = properties.getNotifications();
        List<Task> pending = taskRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(userId, TaskStatus.PENDING);
        List<Task> inProgress = taskRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(userId, TaskStatus.IN_PROGRESS);
        List<Task> completedRecently = taskRepository.findByOwnerIdAndStatusAndCompletedAtGreaterThanEqual(userId,
                TaskStatus.COMPLETED, now.minusHours(24));
        List<Task> important = new ArrayList<>();
        pending.stream().filter(task -> task.getPriority().isElevated()).forEach(important::add);
        inProgress.stream().filter(task -> task.getPriority().isElevated()).forEach(important::add);

        StringBuilder text = new StringBuilder("Good morning! Here is your daily digest.\n\n");
        text.append("Today:\n")
                .append("- Pending: ").append(pending.size()).append('\n')
                .append("- In progress: ").append(inProgress.size()).append('\n')
                .append("- Completed in the last 24h: ").append(completedRecently.size()).append("\n\n");
        if (!important.isEmpty()) {
            int limit = config.getDigestHighlightLimit();
            text.append("Important tasks for today:\n")
                    .append(taskFormatter.numbered(important.subList(0, Math.min(limit, important.size()))))
                    .append('\n');
            if (important.size() > limit) {
                text.append("... and ").append(important.size() - limit).append(" more important tasks\n");
            }
            text.append('\n');
        }
        if (!completedRecently.isEmpty()) {
            text.append("Great work! You finished ").append(completedRecently.size())
                    .append(" tasks in the last 24 hours.\n\n");
        }
        text.append("Tip of the day: ");
        if (important.size() > config.getDigestHighlightLimit()) {
            text.append("You have many important tasks. Try the Pomodoro technique to stay focused.");
        } else if (pending.isEmpty() && inProgress.isEmpty()) {
            text.append("Everything is done. A good moment to plan new goals or to rest.");
        } else {
            text.append("Start the day with your most important task, it sets the pace for everything else.");
        }
        return text.toString();
    }

    String buildDeadlineReminder(List<Task> tasks, OffsetDateTime now) {
        int limit = properties.getNotifications().getDeadlineListLimit();
        StringBuilder text = new StringBuilder("Deadline reminder\n\n")
                .append("You have ").append(tasks.size()).append(" tasks with approaching deadlines:\n\n");
        for (int index = 0; index < Math.min(limit, tasks.size()); index++) {
            Task task = tasks.get(index);
            text.append(index + 1).append(". ").append(taskFormatter.line(task))
                    .append(" (").append(timeLeft(Duration.between(now, task.getDueAt()))).append(")\n");
        }
        if (tasks.size() > limit) {
            text.append("\n... and ").append(tasks.size() - limit).append(" more tasks\n");
        }
        text.append("\nFinishing early beats finishing at the last minute!");
        return text.toString();
    }

    private String timeLeft(Duration left) {
        if (left.isNegative()) {
            return "overdue";
        }
        if (left.toHours() < 1) {
            return "less than an hour";
        }
        if (left.toHours() < 24) {
            return "in " + left.toHours() + " h";
        }
        return "in " + left.toDays() + " d";
    }

    private Optional<TrackerUser> eligibleUser(String userId, NotificationType type) {
        return userRepository.findById(userId)
                .filter(TrackerUser::isOnboardingComplete)
                .filter(user -> user.getNotifications().allows(type));
    }

    private void markSent(String userId, NotificationType type, String key) {
        dispatchRepository.save(NotificationDispatch.builder()
                .ownerId(userId)
                .type(type)
                .dispatchKey(key)
                .sentAt(OffsetDateTime.now(clock))
                .build());
    }

    private static String deadlineKey(Task task) {
        return task.getId() + "@" + task.getDueAt().toInstant();
    }
}
