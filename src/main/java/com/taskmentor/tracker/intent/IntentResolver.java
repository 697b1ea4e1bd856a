package com.taskmentor.tracker.intent;

import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.completion.CompletionService;
import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.Task;
import com.taskmentor.tracker.task.TaskFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * Turns an utterance into an {@link IntentDecision}. The model classifies the action and names the
 * task; candidates for update and delete are always checked against the owner's own tasks and are
 * never guessed when several match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentResolver {

    private final CompletionService completionService;
    private final TaskMatcher taskMatcher;
    private final KeywordIntentClassifier keywordClassifier;
    private final TaskFormatter taskFormatter;
    private final TaskMentorProperties properties;

    /**
     * Resolves through the intent model.
     *
     * @throws CompletionFailureException when the model times out, fails or returns malformed JSON
     */
    public IntentDecision resolve(String utterance, List<Task> tasks, String dialogue) {
        IntentReply reply = completionService.completeJson(PURPOSE_INTENT, INTENT_SYSTEM_PROMPT, INTENT_USER_TEMPLATE,
                Map.of("input", utterance,
                        "tasks", taskFormatter.registry(tasks),
                        "dialogue", dialogue),
                IntentReply.class);
        return decide(reply, tasks, IntentSource.MODEL);
    }

    public IntentDecision fallback(String utterance, List<Task> tasks) {
        return decide(keywordClassifier.classify(utterance), tasks, IntentSource.KEYWORD);
    }

    IntentDecision decide(IntentReply reply, List<Task> tasks, IntentSource source) {
        IntentAction action = reply.action() != null ? reply.action() : IntentAction.UNKNOWN;
        if (!action.targetsExistingTask()) {
            return decision(reply, action, List.of(), false, source, List.of());
        }

        List<SelectedTask> candidates = candidatesByPhrase(reply.searchPhrase(), tasks);
        if (candidates.isEmpty()) {
            candidates = candidatesByModelIds(reply.taskIds(), tasks);
        }
        log.debug("Resolved {} by {} to {} candidates", action.value(), source, candidates.size());
        if (candidates.isEmpty()) {
            return decision(reply, action, List.of(), false, source, suggestions(tasks));
        }
        if (candidates.size() == 1) {
            return decision(reply, action, candidates, true, source, List.of());
        }
        int limit = properties.getIntent().getDisambiguationLimit();
        return decision(reply, action, candidates.subList(0, Math.min(limit, candidates.size())), false, source,
                List.of());
    }

    private List<SelectedTask> candidatesByPhrase(String phrase, List<Task> tasks) {
        if (!StringUtils.hasText(phrase)) {
            return List.of();
        }
        return taskMatcher.match(phrase, tasks).stream()
                .map(match -> new SelectedTask(match.task().getId(), match.task().getTitle(), match.confidence(),
                        "matched by " + match.tier().name().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Ids the model proposed, kept only when they belong to the owner.
     */
    private List<SelectedTask> candidatesByModelIds(List<IntentReply.TaskRef> refs, List<Task> tasks) {
        if (refs == null || refs.isEmpty()) {
            return List.of();
        }
        Map<UUID, Task> owned = tasks.stream()
                .collect(Collectors.toMap(Task::getId, Function.identity(), (left, right) -> left, LinkedHashMap::new));
        Map<UUID, SelectedTask> selected = new LinkedHashMap<>();
        for (IntentReply.TaskRef ref : refs) {
            if (ref == null) {
                continue;
            }
            UUID id = parseId(ref.taskId());
            Task task = id != null ? owned.get(id) : null;
            if (task == null) {
                log.warn("Dropping task id {} proposed by the intent model: not owned by the user", ref.taskId());
                continue;
            }
            double confidence = ref.confidence() != null ? Math.max(0.0, Math.min(1.0, ref.confidence())) : 0.5;
            selected.putIfAbsent(id, new SelectedTask(id, task.getTitle(), confidence,
                    Objects.requireNonNullElse(ref.reasoning(), "selected by model")));
        }
        List<SelectedTask> result = new ArrayList<>(selected.values());
        result.sort(Comparator.comparingDouble(SelectedTask::confidence).reversed());
        return result;
    }

    private List<SelectedTask> suggestions(List<Task> tasks) {
        return tasks.stream()
                .sorted(Comparator.comparing((Task task) -> !task.getStatus().isActive()))
                .limit(properties.getIntent().getSuggestionLimit())
                .map(task -> new SelectedTask(task.getId(), task.getTitle(), 0.0, "suggestion"))
                .toList();
    }

    private IntentDecision decision(IntentReply reply, IntentAction action, List<SelectedTask> selected,
                                    boolean requiresConfirmation, IntentSource source,
                                    List<SelectedTask> suggestions) {
        return new IntentDecision(action, List.copyOf(selected), requiresConfirmation, reply.suggestedResponse(),
                reply.searchPhrase(), reply.title(), reply.description(), reply.priority(), reply.targetStatus(),
                reply.targetPriority(), source, suggestions);
    }

    private static UUID parseId(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
