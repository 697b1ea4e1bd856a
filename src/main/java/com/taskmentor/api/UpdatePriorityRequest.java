package com.taskmentor.api;

import com.taskmentor.entity.TaskPriority;
import jakarta.validation.constraints.NotNull;

public record UpdatePriorityRequest(
        @NotNull TaskPriority priority
) {
}
