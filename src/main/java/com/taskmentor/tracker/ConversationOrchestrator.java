package com.taskmentor.tracker;

import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.completion.CompletionMetricsService;
import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.ConfirmationAction;
import com.taskmentor.entity.DialogueTurn;
import com.taskmentor.entity.EveningSession;
import com.taskmentor.entity.EveningSessionState;
import com.taskmentor.entity.PendingConfirmation;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.entity.UserView;
import com.taskmentor.tracker.intent.ConfirmationPhrases;
import com.taskmentor.tracker.intent.IntentAction;
import com.taskmentor.tracker.intent.IntentDecision;
import com.taskmentor.tracker.intent.IntentResolver;
import com.taskmentor.tracker.intent.SelectedTask;
import com.taskmentor.tracker.session.OnboardingService;
import com.taskmentor.tracker.session.ReflectionService;
import com.taskmentor.tracker.task.TaskAnalytics;
import com.taskmentor.tracker.task.TaskFormatter;
import com.taskmentor.tracker.task.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * Entry point for every inbound chat message. Routes the turn to onboarding, an active evening
 * reflection, a pending confirmation or intent resolution, and records the exchange in the user's
 * dialogue history. All work for one user runs under that user's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationOrchestrator {

    private final UserLockRegistry lockRegistry;
    private final ConversationContextService contextService;
    private final OnboardingService onboardingService;
    private final ReflectionService reflectionService;
    private final IntentResolver intentResolver;
    private final ConfirmationPhrases confirmationPhrases;
    private final TaskStore taskStore;
    private final TaskFormatter taskFormatter;
    private final MentorService mentorService;
    private final ChatTransport chatTransport;
    private final CompletionMetricsService metricsService;
    private final TaskMentorProperties properties;

    public ChatReply handle(InboundMessage message) {
        if (message == null || !StringUtils.hasText(message.userId())) {
            throw new IllegalArgumentException("userId is required");
        }
        ChatReply reply = lockRegistry.withLock(message.userId(), () -> handleLocked(message));
        if (reply.route() != Route.DUPLICATE) {
            chatTransport.send(reply.userId(), reply.text());
        }
        return reply;
    }

    private ChatReply handleLocked(InboundMessage message) {
        TrackerUser user = contextService.loadOrCreate(message.userId());
        if (StringUtils.hasText(message.messageId())
                && message.messageId().equals(user.getLastMessageId())
                && user.getLastReply() != null) {
            log.info("Message {} of {} already handled, returning the stored reply", message.messageId(),
                    user.getUserId());
            return new ChatReply(user.getUserId(), user.getLastReply(), Route.DUPLICATE);
        }

        String text = message.text() != null ? message.text().trim() : "";
        Reply reply = route(user, text, message.action());

        String userTurn = StringUtils.hasText(text) ? text : Optional.ofNullable(message.action()).orElse("");
        contextService.appendDialogue(user, DialogueTurn.ROLE_USER, userTurn);
        contextService.appendDialogue(user, DialogueTurn.ROLE_ASSISTANT, reply.text());
        user.setLastMessageId(message.messageId());
        user.setLastReply(reply.text());
        contextService.save(user);
        log.debug("Handled message for {} via {}", user.getUserId(), reply.route());
        return new ChatReply(user.getUserId(), reply.text(), reply.route());
    }

    private Reply route(TrackerUser user, String text, String action) {
        if (!user.isOnboardingComplete()) {
            return new Reply(onboardingService.handle(user, text, action), Route.ONBOARDING);
        }

        Optional<EveningSession> session = reflectionService.activeSession(user.getUserId());
        if (session.isPresent()) {
            String reply = reflectionService.handle(session.get(), text);
            user.setCurrentView(session.get().getState() == EveningSessionState.COMPLETED
                    ? UserView.MAIN : UserView.REFLECTION);
            return new Reply(reply, Route.REFLECTION);
        }

        PendingConfirmation pending = user.getPendingConfirmation();
        if (pending != null && pending.getAction() != null) {
            user.setPendingConfirmation(null);
            if (pending.isExpired(contextService.now(), properties.getIntent().getConfirmationWindow())) {
                log.info("Pending {} of {} expired", pending.getAction(), user.getUserId());
            } else if (confirmationPhrases.isAffirmative(text)) {
                return new Reply(confirm(user, pending, text), Route.CONFIRMATION);
            }
        }

        if (!StringUtils.hasText(text)) {
            return new Reply("Tell me what you'd like to do, for example \"show my tasks\" or \"add task <title>\".",
                    Route.FALLBACK);
        }
        return resolveAndDispatch(user, text);
    }

    private String confirm(TrackerUser user, PendingConfirmation pending, String text) {
        Optional<UUID> mentioned = confirmationPhrases.extractTaskId(text);
        if (mentioned.isPresent() && !mentioned.get().equals(pending.getTaskId())) {
            return "That id does not match the task waiting for confirmation. Nothing was changed.";
        }
        String ownerId = user.getUserId();
        OperationResult<?> result = switch (pending.getAction()) {
            case DELETE -> taskStore.delete(pending.getTaskId(), ownerId);
            case UPDATE_STATUS -> taskStore.updateStatus(pending.getTaskId(), ownerId, pending.getTargetStatus());
            case UPDATE_PRIORITY -> taskStore.updatePriority(pending.getTaskId(), ownerId,
                    pending.getTargetPriority());
        };
        if (!result.isSuccess()) {
            return result.message();
        }
        log.info("Confirmed {} of task {} for {}", pending.getAction(), pending.getTaskId(), ownerId);
        user.setCurrentView(UserView.TASKS);
        if (pending.getAction() == ConfirmationAction.DELETE) {
            return "Deleted task: " + pending.getTaskTitle();
        }
        return "Updated: " + taskFormatter.line((Task) result.value());
    }

    private Reply resolveAndDispatch(TrackerUser user, String text) {
        List<Task> tasks = taskStore.list(user.getUserId(), null);
        IntentDecision decision;
        try {
            decision = intentResolver.resolve(text, tasks, contextService.dialogueWindow(user));
        } catch (CompletionFailureException ex) {
            log.warn("Intent resolution failed for {}, using keyword fallback: {}", user.getUserId(), ex.getMessage());
            metricsService.recordFallback(PURPOSE_INTENT, "keyword");
            decision = intentResolver.fallback(text, tasks);
        }

        return switch (decision.action()) {
            case CREATE -> new Reply(create(user, decision), Route.TASK);
            case VIEW -> new Reply(view(user, tasks), Route.TASK);
            case STATS -> new Reply(stats(user), Route.TASK);
            case UPDATE, DELETE -> new Reply(surfaceForConfirmation(user, decision), Route.TASK);
            case REFLECT -> new Reply(startReflection(user), Route.REFLECTION);
            case UNKNOWN -> advise(user, text, decision);
        };
    }

    private String create(TrackerUser user, IntentDecision decision) {
        OperationResult<Task> result = taskStore.create(user.getUserId(), decision.title(), decision.description(),
                decision.priority(), null);
        if (!result.isSuccess()) {
            return result.is(ErrorKind.VALIDATION)
                    ? "I need a title for the task. Try \"add task <title>\"."
                    : result.message();
        }
        user.setCurrentView(UserView.TASKS);
        return "Created task: " + taskFormatter.line(result.value());
    }

    private String view(TrackerUser user, List<Task> tasks) {
        user.setCurrentView(UserView.TASKS);
        if (tasks.isEmpty()) {
            return "You have no tasks yet. Add one with \"add task <title>\".";
        }
        return "Your tasks:\n" + taskFormatter.numbered(tasks);
    }

    private String stats(TrackerUser user) {
        TaskAnalytics analytics = taskStore.analytics(user.getUserId());
        return "Your statistics:\n"
                + "Total: " + analytics.total() + "\n"
                + "Completed: " + analytics.completed() + "\n"
                + "In progress: " + analytics.inProgress() + "\n"
                + "Pending: " + analytics.pending() + "\n"
                + "Cancelled: " + analytics.cancelled() + "\n"
                + "Completion rate: " + analytics.completionRate() + "%";
    }

    /**
     * Never mutates: a single candidate becomes the pending confirmation, several candidates or
     * none are reported back.
     */
    private String surfaceForConfirmation(TrackerUser user, IntentDecision decision) {
        String phrase = StringUtils.hasText(decision.searchPhrase()) ? decision.searchPhrase() : "that";
        if (decision.hasNoMatch()) {
            StringBuilder reply = new StringBuilder("I couldn't find a task matching \"").append(phrase).append("\".");
            if (!decision.suggestions().isEmpty()) {
                reply.append(" Your tasks include:");
                decision.suggestions().forEach(suggestion -> reply.append("\n- ").append(suggestion.title()));
            }
            return reply.toString();
        }
        if (decision.isAmbiguous()) {
            StringBuilder reply = new StringBuilder("Several tasks match \"").append(phrase).append("\":");
            List<SelectedTask> candidates = decision.selectedTasks();
            for (int index = 0; index < candidates.size(); index++) {
                reply.append("\n").append(index + 1).append(". ").append(candidates.get(index).title());
            }
            return reply.append("\nPlease use a more specific phrase.").toString();
        }

        SelectedTask candidate = decision.selectedTasks().get(0);
        Optional<Task> task = taskStore.find(candidate.taskId(), user.getUserId());
        if (task.isEmpty()) {
            return "I couldn't find a task matching \"" + phrase + "\".";
        }
        ConfirmationAction action;
        String question;
        if (decision.action() == IntentAction.DELETE) {
            action = ConfirmationAction.DELETE;
            question = "Delete this task?";
        } else if (decision.targetStatus() != null) {
            action = ConfirmationAction.UPDATE_STATUS;
            question = "Mark this task as " + decision.targetStatus().value() + "?";
        } else if (decision.targetPriority() != null) {
            action = ConfirmationAction.UPDATE_PRIORITY;
            question = "Set the priority of this task to " + decision.targetPriority().value() + "?";
        } else {
            return "What should change on this task? Try a status (\"mark it done\") or a priority.\n"
                    + taskFormatter.details(task.get());
        }
        user.setPendingConfirmation(PendingConfirmation.builder()
                .action(action)
                .taskId(candidate.taskId())
                .taskTitle(task.get().getTitle())
                .targetStatus(decision.targetStatus())
                .targetPriority(decision.targetPriority())
                .surfacedAt(contextService.now())
                .build());
        return question + "\n" + taskFormatter.details(task.get()) + "\nReply \"yes\" to confirm.";
    }

    private String startReflection(TrackerUser user) {
        OperationResult<EveningSession> result = reflectionService.start(user.getUserId(), contextService.today(user));
        if (!result.isSuccess()) {
            return result.message();
        }
        user.setCurrentView(UserView.REFLECTION);
        return reflectionService.openingMessage(result.value());
    }

    private Reply advise(TrackerUser user, String text, IntentDecision decision) {
        try {
            return new Reply(mentorService.advise(user, text), Route.ADVICE);
        } catch (CompletionFailureException ex) {
            log.warn("Advice generation failed for {}: {}", user.getUserId(), ex.getMessage());
            metricsService.recordFallback(PURPOSE_ADVICE, "fixed-reply");
            String suggested = decision.suggestedResponse();
            return new Reply(StringUtils.hasText(suggested) ? suggested : FALLBACK_REPLY, Route.FALLBACK);
        }
    }

    private record Reply(String text, Route route) {
    }
}
