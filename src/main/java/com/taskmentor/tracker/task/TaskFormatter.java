package com.taskmentor.tracker.task;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of tasks for chat replies, notifications and prompts.
 */
@Component
public class TaskFormatter {

    private static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public String line(Task task) {
        StringBuilder builder = new StringBuilder()
                .append(statusMarker(task.getStatus()))
                .append(' ')
                .append(task.getTitle())
                .append(" (").append(task.getPriority().value()).append(')');
        if (task.getDueAt() != null) {
            builder.append(", due ").append(DUE_FORMAT.format(task.getDueAt()));
        }
        return builder.toString();
    }

    public String numbered(List<Task> tasks) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < tasks.size(); index++) {
            builder.append(index + 1).append(". ").append(line(tasks.get(index))).append('\n');
        }
        return builder.toString().stripTrailing();
    }

    public String details(Task task) {
        StringBuilder builder = new StringBuilder(line(task));
        if (StringUtils.hasText(task.getDescription())) {
            builder.append("\n").append(task.getDescription());
        }
        builder.append("\nid: ").append(task.getId());
        return builder.toString();
    }

    /**
     * Compact registry handed to the intent model; ids let the model reference tasks.
     */
    public String registry(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return "No tasks.";
        }
        return tasks.stream()
                .map(task -> "- id=" + task.getId()
                        + " | title=" + task.getTitle()
                        + " | description=" + (task.getDescription() != null ? task.getDescription() : "")
                        + " | status=" + task.getStatus().value()
                        + " | priority=" + task.getPriority().value())
                .collect(Collectors.joining("\n"));
    }

    private String statusMarker(TaskStatus status) {
        return switch (status) {
            case PENDING -> "[ ]";
            case IN_PROGRESS -> "[~]";
            case COMPLETED -> "[x]";
            case CANCELLED -> "[-]";
        };
    }
}
