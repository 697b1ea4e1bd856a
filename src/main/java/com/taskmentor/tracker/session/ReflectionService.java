package com.taskmentor.tracker.session;

import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.completion.CompletionService;
import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.DailySummary;
import com.taskmentor.entity.DialogueTurn;
import com.taskmentor.entity.EveningSession;
import com.taskmentor.entity.EveningSessionState;
import com.taskmentor.entity.ProductivityLevel;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskReviewItem;
import com.taskmentor.repository.DailySummaryRepository;
import com.taskmentor.repository.EveningSessionRepository;
import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import com.taskmentor.tracker.task.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * The nightly reflection: review each active task, capture one gratitude, then synthesize and
 * store a {@link DailySummary}. A session exists at most once per user and date, only moves
 * forward, and a user has at most one unfinished session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectionService {

    private final EveningSessionRepository sessionRepository;
    private final DailySummaryRepository summaryRepository;
    private final TaskStore taskStore;
    private final CompletionService completionService;
    private final GuidedFlowService flowService;
    private final TaskMentorProperties properties;
    private final Clock clock;

    public OperationResult<EveningSession> start(String ownerId, LocalDate date) {
        if (sessionRepository.existsByOwnerIdAndSessionDate(ownerId, date)) {
            return OperationResult.failure(ErrorKind.VALIDATION,
                    "You already had an evening session today. Let's continue tomorrow!");
        }
        if (activeSession(ownerId).isPresent()) {
            return OperationResult.failure(ErrorKind.VALIDATION,
                    "Your previous evening session is not finished yet. Let's wrap it up first.");
        }
        List<Task> eligible = taskStore.list(ownerId, null).stream()
                .filter(task -> task.getStatus().isActive())
                .sorted(Comparator.comparing(Task::getCreatedAt))
                .toList();
        if (eligible.isEmpty()) {
            return OperationResult.failure(ErrorKind.VALIDATION,
                    "You have no active tasks to review. Add a few tasks first.");
        }
        EveningSession session = EveningSession.builder()
                .ownerId(ownerId)
                .sessionDate(date)
                .state(EveningSessionState.STARTING)
                .startedAt(OffsetDateTime.now(clock))
                .build();
        eligible.forEach(task -> session.getReviewItems().add(TaskReviewItem.builder()
                .taskId(task.getId())
                .taskTitle(task.getTitle())
                .build()));
        String opening = openingMessage(session);
        session.getTranscript().add(turn(DialogueTurn.ROLE_ASSISTANT, opening));
        EveningSession saved = sessionRepository.save(session);
        log.info("Started evening session {} for {} with {} tasks", saved.getId(), ownerId, eligible.size());
        return OperationResult.success(saved);
    }

    /**
     * The owner's unfinished session, if any. A session begun before midnight keeps its date and
     * stays active until it completes.
     */
    public Optional<EveningSession> activeSession(String ownerId) {
        return sessionRepository.findFirstByOwnerIdAndStateNotOrderBySessionDateDesc(ownerId,
                EveningSessionState.COMPLETED);
    }

    public String openingMessage(EveningSession session) {
        return "Good evening! Let's look back at your day. We'll go through "
                + session.getReviewItems().size() + " active tasks, then end on a positive note.\n"
                + "Reply anything when you're ready.";
    }

    public List<DailySummary> summaries(String ownerId) {
        return summaryRepository.findByOwnerIdOrderBySummaryDateAsc(ownerId);
    }

    /**
     * Consumes one user reply and persists the session.
     */
    public String handle(EveningSession session, String text) {
        String message = text != null ? text.trim() : "";
        session.getTranscript().add(turn(DialogueTurn.ROLE_USER, message));
        String reply = switch (session.getState()) {
            case STARTING -> {
                moveTo(session, EveningSessionState.TASK_REVIEW);
                yield taskQuestion(session);
            }
            case TASK_REVIEW -> handleTaskReview(session, message);
            case GRATITUDE -> handleGratitude(session, message);
            case SUMMARY -> synthesizeSummary(session);
            case COMPLETED -> "This evening session is already finished. See you tomorrow!";
        };
        session.getTranscript().add(turn(DialogueTurn.ROLE_ASSISTANT, reply));
        sessionRepository.save(session);
        return reply;
    }

    private String handleTaskReview(EveningSession session, String message) {
        TaskReviewItem item = session.currentItem();
        if (item.getProgressDescription() == null) {
            item.setProgressDescription(message);
            if (indicatesNoProgress(message)) {
                item.setNeedsHelp(true);
                String offer = generate(PURPOSE_HELP_OFFER, HELP_OFFER_TEMPLATE,
                        Map.of("task", item.getTaskTitle(), "progress", message), FALLBACK_HELP_OFFER);
                return offer + HELP_OFFER_QUESTION;
            }
            String support = generate(PURPOSE_TASK_SUPPORT, TASK_SUPPORT_TEMPLATE,
                    Map.of("task", item.getTaskTitle(), "progress", message), FALLBACK_TASK_SUPPORT);
            item.setSupportText(support);
            item.setCompleted(true);
            return support + "\n\n" + nextItemOrGratitude(session);
        }
        if (item.isNeedsHelp() && item.getHelpProvided() == null) {
            item.setHelpProvided(message);
            String help = generate(PURPOSE_TASK_HELP, TASK_HELP_TEMPLATE,
                    Map.of("task", item.getTaskTitle(), "request", message), FALLBACK_TASK_HELP);
            item.setSupportText(help);
            item.setCompleted(true);
            return help + "\n\n" + nextItemOrGratitude(session);
        }
        item.setCompleted(true);
        return nextItemOrGratitude(session);
    }

    private String nextItemOrGratitude(EveningSession session) {
        session.setCurrentIndex(session.getCurrentIndex() + 1);
        if (session.getCurrentIndex() < session.getReviewItems().size()) {
            return taskQuestion(session);
        }
        moveTo(session, EveningSessionState.GRATITUDE);
        return "Time for gratitude. Let's finish on a positive note: what are you grateful to yourself for "
                + "today? A big achievement or a small step forward, anything counts.";
    }

    private String handleGratitude(EveningSession session, String message) {
        session.setGratitude(message);
        String response = generate(PURPOSE_GRATITUDE, GRATITUDE_TEMPLATE, Map.of("gratitude", message),
                FALLBACK_GRATITUDE);
        moveTo(session, EveningSessionState.SUMMARY);
        return response + "\n\n" + synthesizeSummary(session);
    }

    private String synthesizeSummary(EveningSession session) {
        List<TaskReviewItem> items = session.getReviewItems();
        int reviewed = items.size();
        int withProgress = (int) items.stream()
                .filter(item -> StringUtils.hasText(item.getProgressDescription()) && !item.isNeedsHelp())
                .count();
        int needingHelp = (int) items.stream().filter(TaskReviewItem::isNeedsHelp).count();
        ProductivityLevel level = productivityLevel(withProgress, reviewed);
        String review = items.stream()
                .map(item -> "- " + item.getTaskTitle() + ": " + item.getProgressDescription())
                .collect(Collectors.joining("\n"));
        String gratitude = session.getGratitude() != null ? session.getGratitude() : "";
        String text = generate(PURPOSE_DAILY_SUMMARY, DAILY_SUMMARY_TEMPLATE,
                Map.of("review", review,
                        "gratitude", gratitude,
                        "withProgress", withProgress,
                        "reviewed", reviewed),
                FALLBACK_SUMMARY);

        session.setSummary(text);
        appendSummary(DailySummary.builder()
                .ownerId(session.getOwnerId())
                .summaryDate(session.getSessionDate())
                .tasksReviewed(reviewed)
                .tasksWithProgress(withProgress)
                .tasksNeedingHelp(needingHelp)
                .gratitudeTheme(truncate(gratitude, properties.getReflection().getGratitudeThemeLength()))
                .productivityLevel(level)
                .summaryText(text)
                .build());
        moveTo(session, EveningSessionState.COMPLETED);
        session.setCompletedAt(OffsetDateTime.now(clock));
        log.info("Evening session {} of {} completed ({} productivity)", session.getId(), session.getOwnerId(),
                level.value());
        return "Daily summary\n\n" + text + "\n\nThe evening session is complete. Good night!";
    }

    static ProductivityLevel productivityLevel(int withProgress, int reviewed) {
        if (withProgress > reviewed * 0.7) {
            return ProductivityLevel.HIGH;
        }
        if (withProgress > 0) {
            return ProductivityLevel.MEDIUM;
        }
        return ProductivityLevel.LOW;
    }

    /**
     * Appends to the owner's summary history and evicts the oldest entries beyond the cap.
     */
    private void appendSummary(DailySummary summary) {
        summaryRepository.save(summary);
        List<DailySummary> history = summaryRepository.findByOwnerIdOrderBySummaryDateAsc(summary.getOwnerId());
        int overflow = history.size() - properties.getReflection().getSummaryHistoryLimit();
        if (overflow > 0) {
            summaryRepository.deleteAll(history.subList(0, overflow));
            log.debug("Evicted {} old daily summaries of {}", overflow, summary.getOwnerId());
        }
    }

    private String taskQuestion(EveningSession session) {
        TaskReviewItem item = session.currentItem();
        return "Task " + (session.getCurrentIndex() + 1) + "/" + session.getReviewItems().size() + "\n\n"
                + "What did you manage to do today on: " + item.getTaskTitle() + "?\n"
                + "If nothing happened, that's fine too, just say \"nothing\".";
    }

    private boolean indicatesNoProgress(String message) {
        String normalized = message.toLowerCase(Locale.ROOT).replace('’', '\'');
        return NEGATIVE_OUTCOME_PHRASES.stream().anyMatch(normalized::contains);
    }

    private String generate(String purpose, String template, Map<String, Object> params, String fallback) {
        try {
            return completionService.complete(purpose, REFLECTION_SYSTEM_PROMPT, template, params);
        } catch (CompletionFailureException ex) {
            log.warn("Reflection text generation failed ({}), using fixed text: {}", purpose, ex.getMessage());
            return fallback;
        }
    }

    private void moveTo(EveningSession session, EveningSessionState target) {
        EveningSessionState next = flowService.advance(session.getState());
        if (next != target) {
            throw new IllegalStateException("Reflection cannot move from " + session.getState() + " to " + target);
        }
        session.setState(next);
    }

    private DialogueTurn turn(String role, String content) {
        return new DialogueTurn(role, content, OffsetDateTime.now(clock));
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
