package com.taskmentor.tracker.task;

import com.taskmentor.entity.TaskPriority;

import java.util.Map;

public record TaskAnalytics(
        long total,
        long completed,
        long inProgress,
        long pending,
        long cancelled,
        double completionRate,
        Map<TaskPriority, Long> priorityDistribution
) {
}
