package com.taskmentor.api;

import jakarta.validation.constraints.NotBlank;

public record ChatRequest(
        @NotBlank String userId,
        String text,
        String action,
        String messageId
) {
}
