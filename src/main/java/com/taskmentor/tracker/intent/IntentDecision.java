package com.taskmentor.tracker.intent;

import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Resolved action for one utterance. For update and delete, {@code selectedTasks} holds the
 * validated candidates: one candidate means the action waits for confirmation, several mean the
 * user has to narrow the phrase, none means {@code suggestions} lists what exists.
 */
public record IntentDecision(
        IntentAction action,
        List<SelectedTask> selectedTasks,
        boolean requiresConfirmation,
        @Nullable String suggestedResponse,
        @Nullable String searchPhrase,
        @Nullable String title,
        @Nullable String description,
        @Nullable TaskPriority priority,
        @Nullable TaskStatus targetStatus,
        @Nullable TaskPriority targetPriority,
        IntentSource source,
        List<SelectedTask> suggestions
) {

    public boolean isAmbiguous() {
        return selectedTasks.size() > 1;
    }

    public boolean hasNoMatch() {
        return selectedTasks.isEmpty();
    }
}
