package com.taskmentor.api;

import com.taskmentor.entity.DailySummary;
import com.taskmentor.entity.ProductivityLevel;

import java.time.LocalDate;

public record DailySummaryResponse(
        LocalDate date,
        int tasksReviewed,
        int tasksWithProgress,
        int tasksNeedingHelp,
        String gratitudeTheme,
        ProductivityLevel productivityLevel,
        String summary
) {

    public static DailySummaryResponse from(DailySummary summary) {
        return new DailySummaryResponse(summary.getSummaryDate(), summary.getTasksReviewed(),
                summary.getTasksWithProgress(), summary.getTasksNeedingHelp(), summary.getGratitudeTheme(),
                summary.getProductivityLevel(), summary.getSummaryText());
    }
}
