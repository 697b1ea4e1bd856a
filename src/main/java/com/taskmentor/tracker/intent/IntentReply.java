package com.taskmentor.tracker.intent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;

import java.util.List;

/**
 * Structured classification as returned by the intent model, or produced by the keyword
 * classifier. Task ids are unvalidated at this point.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentReply(
        @JsonProperty("action") IntentAction action,
        @JsonProperty("search_phrase") String searchPhrase,
        @JsonProperty("task_ids") List<TaskRef> taskIds,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("priority") TaskPriority priority,
        @JsonProperty("target_status") TaskStatus targetStatus,
        @JsonProperty("target_priority") TaskPriority targetPriority,
        @JsonProperty("suggested_response") String suggestedResponse
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskRef(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("reasoning") String reasoning
    ) {
    }

    public static IntentReply of(IntentAction action) {
        return new IntentReply(action, null, List.of(), null, null, null, null, null, null);
    }
}
