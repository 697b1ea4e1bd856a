package com.taskmentor.tracker.task;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.repository.TaskRepository;
import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import com.taskmentor.tracker.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTaskStore implements TaskStore {

    private static final int MAX_TITLE_LENGTH = 500;

    private final TaskRepository taskRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    @Override
    public OperationResult<Task> create(String ownerId, String title, @Nullable String description,
                                        @Nullable TaskPriority priority, @Nullable OffsetDateTime dueAt) {
        if (!StringUtils.hasText(ownerId)) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Owner is required.");
        }
        if (!StringUtils.hasText(title)) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Task title is required.");
        }
        String normalizedTitle = title.trim();
        if (normalizedTitle.length() > MAX_TITLE_LENGTH) {
            return OperationResult.failure(ErrorKind.VALIDATION,
                    "Task title must be at most " + MAX_TITLE_LENGTH + " characters.");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Task task = Task.builder()
                .ownerId(ownerId)
                .title(normalizedTitle)
                .description(StringUtils.hasText(description) ? description.trim() : "")
                .priority(priority != null ? priority : TaskPriority.MEDIUM)
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .dueAt(dueAt)
                .build();
        Task saved;
        try {
            saved = taskRepository.save(task);
        } catch (DataAccessException ex) {
            log.error("Failed to create task for {}", ownerId, ex);
            return OperationResult.failure(ErrorKind.PERSISTENCE, "The task could not be saved. Please try again.");
        }
        log.info("Created task {} for {}", saved.getId(), ownerId);
        notificationService.notifyNewTask(ownerId, saved);
        return OperationResult.success(saved);
    }

    @Override
    public List<Task> list(String ownerId, @Nullable TaskStatus status) {
        if (status == null) {
            return taskRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
        }
        return taskRepository.findByOwnerIdAndStatusOrderByCreatedAtDesc(ownerId, status);
    }

    @Override
    public Optional<Task> find(UUID id, String ownerId) {
        if (id == null || ownerId == null) {
            return Optional.empty();
        }
        return taskRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    public OperationResult<Task> updateStatus(UUID id, String ownerId, TaskStatus status) {
        if (status == null) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Status is required.");
        }
        Optional<Task> existing = find(id, ownerId);
        if (existing.isEmpty()) {
            return notFound(id);
        }
        Task task = existing.get();
        TaskStatus previousStatus = task.getStatus();
        OffsetDateTime previousCompletedAt = task.getCompletedAt();
        OffsetDateTime previousUpdatedAt = task.getUpdatedAt();
        OffsetDateTime now = OffsetDateTime.now(clock);
        task.setStatus(status);
        task.setCompletedAt(status == TaskStatus.COMPLETED ? now : null);
        task.setUpdatedAt(now);
        try {
            return OperationResult.success(taskRepository.save(task));
        } catch (DataAccessException ex) {
            task.setStatus(previousStatus);
            task.setCompletedAt(previousCompletedAt);
            task.setUpdatedAt(previousUpdatedAt);
            log.error("Failed to update status of task {}", id, ex);
            return OperationResult.failure(ErrorKind.PERSISTENCE, "The task could not be updated. Please try again.");
        }
    }

    @Override
    public OperationResult<Task> updatePriority(UUID id, String ownerId, TaskPriority priority) {
        if (priority == null) {
            return OperationResult.failure(ErrorKind.VALIDATION, "Priority is required.");
        }
        Optional<Task> existing = find(id, ownerId);
        if (existing.isEmpty()) {
            return notFound(id);
        }
        Task task = existing.get();
        TaskPriority previousPriority = task.getPriority();
        OffsetDateTime previousUpdatedAt = task.getUpdatedAt();
        task.setPriority(priority);
        task.setUpdatedAt(OffsetDateTime.now(clock));
        try {
            return OperationResult.success(taskRepository.save(task));
        } catch (DataAccessException ex) {
            task.setPriority(previousPriority);
            task.setUpdatedAt(previousUpdatedAt);
            log.error("Failed to update priority of task {}", id, ex);
            return OperationResult.failure(ErrorKind.PERSISTENCE, "The task could not be updated. Please try again.");
        }
    }

    @Override
    public OperationResult<Boolean> delete(UUID id, String ownerId) {
        Optional<Task> existing = find(id, ownerId);
        if (existing.isEmpty()) {
            return notFound(id);
        }
        try {
            taskRepository.delete(existing.get());
        } catch (DataAccessException ex) {
            log.error("Failed to delete task {}", id, ex);
            return OperationResult.failure(ErrorKind.PERSISTENCE, "The task could not be deleted. Please try again.");
        }
        log.info("Deleted task {} of {}", id, ownerId);
        return OperationResult.success(Boolean.TRUE);
    }

    @Override
    public TaskAnalytics analytics(String ownerId) {
        List<Task> tasks = taskRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        Map<TaskPriority, Long> byPriority = new EnumMap<>(TaskPriority.class);
        for (TaskPriority priority : TaskPriority.values()) {
            byPriority.put(priority, 0L);
        }
        for (Task task : tasks) {
            byStatus.merge(task.getStatus(), 1L, Long::sum);
            byPriority.merge(task.getPriority(), 1L, Long::sum);
        }
        long total = tasks.size();
        long completed = byStatus.getOrDefault(TaskStatus.COMPLETED, 0L);
        return new TaskAnalytics(
                total,
                completed,
                byStatus.getOrDefault(TaskStatus.IN_PROGRESS, 0L),
                byStatus.getOrDefault(TaskStatus.PENDING, 0L),
                byStatus.getOrDefault(TaskStatus.CANCELLED, 0L),
                completionRate(completed, total),
                byPriority);
    }

    @Override
    public List<Task> upcomingDeadlines(String ownerId, OffsetDateTime now, Duration horizon) {
        return taskRepository.findByOwnerIdAndStatusInAndDueAtLessThanEqualOrderByDueAtAsc(ownerId,
                EnumSet.of(TaskStatus.PENDING, TaskStatus.IN_PROGRESS), now.plus(horizon));
    }

    static double completionRate(long completed, long total) {
        if (total <= 0) {
            return 0.0;
        }
        long bounded = Math.max(0, Math.min(completed, total));
        return BigDecimal.valueOf(bounded * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private <T> OperationResult<T> notFound(UUID id) {
        return OperationResult.failure(ErrorKind.NOT_FOUND, "Task " + id + " was not found.");
    }
}
