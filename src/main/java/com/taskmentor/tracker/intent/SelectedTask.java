package com.taskmentor.tracker.intent;

import java.util.UUID;

public record SelectedTask(
        UUID taskId,
        String title,
        double confidence,
        String reasoning
) {
}
