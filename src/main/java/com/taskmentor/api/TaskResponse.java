package com.taskmentor.api;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TaskResponse(
        UUID id,
        String title,
        String description,
        TaskPriority priority,
        TaskStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime dueAt,
        OffsetDateTime completedAt
) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(task.getId(), task.getTitle(), task.getDescription(), task.getPriority(),
                task.getStatus(), task.getCreatedAt(), task.getUpdatedAt(), task.getDueAt(), task.getCompletedAt());
    }
}
