package com.taskmentor.tracker.intent;

import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * Deterministic classification used only when the intent model is unavailable or returns
 * unusable output.
 */
@Service
public class KeywordIntentClassifier {

    public IntentReply classify(@Nullable String utterance) {
        if (!StringUtils.hasText(utterance)) {
            return IntentReply.of(IntentAction.UNKNOWN);
        }
        String original = utterance.trim();
        String text = original.toLowerCase(Locale.ROOT);

        String createPrefix = leadingPhrase(text, CREATE_PREFIXES);
        if (createPrefix != null) {
            String title = stripTitle(original.substring(createPrefix.length()));
            return new IntentReply(IntentAction.CREATE, null, List.of(), title, null,
                    priorityMentioned(text), null, null, null);
        }
        String deleteVerb = leadingPhrase(text, DELETE_VERBS);
        if (deleteVerb != null) {
            return targeted(IntentAction.DELETE, searchPhrase(text.substring(deleteVerb.length())), null, null);
        }
        if (text.contains("priority")) {
            TaskPriority priority = priorityMentioned(text);
            if (priority != null) {
                return targeted(IntentAction.UPDATE, searchPhrase(text), null, priority);
            }
        }
        TaskStatus status = statusMentioned(text);
        if (status != null && !startsReflection(text, status)) {
            return targeted(IntentAction.UPDATE, searchPhrase(stripStatusVerb(text)), status, null);
        }
        if (REFLECT_PHRASES.stream().anyMatch(text::contains)) {
            return IntentReply.of(IntentAction.REFLECT);
        }
        if (STATS_PHRASES.stream().anyMatch(text::contains)) {
            return IntentReply.of(IntentAction.STATS);
        }
        if (VIEW_PHRASES.stream().anyMatch(text::contains)) {
            return IntentReply.of(IntentAction.VIEW);
        }
        return IntentReply.of(IntentAction.UNKNOWN);
    }

    /**
     * "start my evening reflection" opens a session rather than starting a task.
     */
    private boolean startsReflection(String text, TaskStatus status) {
        return status == TaskStatus.IN_PROGRESS
                && REFLECT_PHRASES.stream().anyMatch(stripStatusVerb(text)::contains);
    }

    private IntentReply targeted(IntentAction action, String phrase, @Nullable TaskStatus status,
                                 @Nullable TaskPriority priority) {
        return new IntentReply(action, phrase, List.of(), null, null, null, status, priority, null);
    }

    private @Nullable TaskStatus statusMentioned(String text) {
        if (leadingPhrase(text, COMPLETE_VERBS) != null
                || (text.startsWith("mark ") && COMPLETE_SUFFIXES.stream().anyMatch(text::endsWith))) {
            return TaskStatus.COMPLETED;
        }
        if (leadingPhrase(text, START_VERBS) != null || text.endsWith(" in progress")) {
            return TaskStatus.IN_PROGRESS;
        }
        if (leadingPhrase(text, CANCEL_VERBS) != null) {
            return TaskStatus.CANCELLED;
        }
        return null;
    }

    private String stripStatusVerb(String text) {
        for (List<String> verbs : List.of(COMPLETE_VERBS, START_VERBS, CANCEL_VERBS)) {
            String verb = leadingPhrase(text, verbs);
            if (verb != null) {
                return text.substring(verb.length());
            }
        }
        return text;
    }

    private @Nullable TaskPriority priorityMentioned(String text) {
        List<String> words = Arrays.asList(text.split("[^\\p{L}]+"));
        for (TaskPriority priority : List.of(TaskPriority.URGENT, TaskPriority.HIGH, TaskPriority.LOW,
                TaskPriority.MEDIUM)) {
            if (words.contains(priority.value())) {
                return priority;
            }
        }
        return null;
    }

    private @Nullable String leadingPhrase(String text, List<String> phrases) {
        return phrases.stream().filter(text::startsWith).findFirst().orElse(null);
    }

    private String searchPhrase(String text) {
        return Arrays.stream(text.split("[^\\p{L}\\p{N}']+"))
                .filter(StringUtils::hasText)
                .filter(word -> !PHRASE_FILLER_WORDS.contains(word))
                .filter(word -> TaskPriority.fromValue(word) == null)
                .collect(Collectors.joining(" "));
    }

    private String stripTitle(String remainder) {
        String title = remainder.trim();
        if (title.toLowerCase(Locale.ROOT).startsWith("task")
                && (title.length() == 4 || !Character.isLetter(title.charAt(4)))) {
            title = title.substring(4).trim();
        }
        while (title.startsWith(":") || title.startsWith("-")) {
            title = title.substring(1).trim();
        }
        return title;
    }
}
