package com.taskmentor.tracker.task;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.tracker.OperationResult;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-partitioned task persistence. Every mutation is scoped by {@code (id, owner)}: a task
 * that exists but belongs to someone else is reported as not found.
 */
public interface TaskStore {

    OperationResult<Task> create(String ownerId, String title, @Nullable String description,
                                 @Nullable TaskPriority priority, @Nullable OffsetDateTime dueAt);

    /**
     * Lists the owner's tasks, most recently created first.
     *
     * @param status optional filter; {@code null} returns every task
     */
    List<Task> list(String ownerId, @Nullable TaskStatus status);

    Optional<Task> find(UUID id, String ownerId);

    /**
     * Changes the status. {@code completedAt} is set when the new status is completed and cleared
     * otherwise.
     */
    OperationResult<Task> updateStatus(UUID id, String ownerId, TaskStatus status);

    OperationResult<Task> updatePriority(UUID id, String ownerId, TaskPriority priority);

    OperationResult<Boolean> delete(UUID id, String ownerId);

    TaskAnalytics analytics(String ownerId);

    /**
     * Active tasks whose due time is at or before {@code now + horizon}, soonest first. Overdue
     * tasks are included.
     */
    List<Task> upcomingDeadlines(String ownerId, OffsetDateTime now, Duration horizon);
}
