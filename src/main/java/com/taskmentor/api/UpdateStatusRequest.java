package com.taskmentor.api;

import com.taskmentor.entity.TaskStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateStatusRequest(
        @NotNull TaskStatus status
) {
}
