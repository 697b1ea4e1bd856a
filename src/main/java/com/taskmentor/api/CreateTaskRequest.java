package com.taskmentor.api;

import com.taskmentor.entity.TaskPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

public record CreateTaskRequest(
        @NotBlank @Size(max = 500) String title,
        String description,
        TaskPriority priority,
        OffsetDateTime dueAt
) {
}
