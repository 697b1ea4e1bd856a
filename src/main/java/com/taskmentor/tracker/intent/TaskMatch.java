package com.taskmentor.tracker.intent;

import com.taskmentor.entity.Task;

public record TaskMatch(
        Task task,
        double confidence,
        MatchTier tier
) {
}
