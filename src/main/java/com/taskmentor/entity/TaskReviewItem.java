package com.taskmentor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.util.UUID;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskReviewItem {

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Column(name = "task_title", length = 500)
    private String taskTitle;

    @Column(name = "progress_description", columnDefinition = "TEXT")
    private String progressDescription;

    @Column(name = "needs_help", nullable = false)
    private boolean needsHelp;

    @Column(name = "help_provided", columnDefinition = "TEXT")
    private String helpProvided;

    @Column(name = "support_text", columnDefinition = "TEXT")
    private String supportText;

    @Column(name = "completed", nullable = false)
    private boolean completed;
}
