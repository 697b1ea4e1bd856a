package com.taskmentor.tracker;

import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.completion.CompletionService;
import com.taskmentor.entity.DailySummary;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.repository.DailySummaryRepository;
import com.taskmentor.tracker.task.TaskAnalytics;
import com.taskmentor.tracker.task.TaskStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * General advice from the mentor persona, grounded in the user's task counts and recent days.
 */
@Service
@RequiredArgsConstructor
public class MentorService {

    private final CompletionService completionService;
    private final TaskStore taskStore;
    private final DailySummaryRepository summaryRepository;
    private final ConversationContextService contextService;

    /**
     * @throws CompletionFailureException when no advice could be generated
     */
    public String advise(TrackerUser user, String message) {
        return ask(PURPOSE_ADVICE, user, message);
    }

    /**
     * First conversation with the mentor during onboarding.
     *
     * @throws CompletionFailureException when no reply could be generated
     */
    public String introduce(TrackerUser user, String message) {
        return ask(PURPOSE_MENTOR_INTRO, user, message);
    }

    private String ask(String purpose, TrackerUser user, String message) {
        return completionService.complete(purpose, MENTOR_SYSTEM_PROMPT, MENTOR_USER_TEMPLATE,
                Map.of("context", userContext(user),
                        "dialogue", contextService.dialogueWindow(user),
                        "input", message));
    }

    String userContext(TrackerUser user) {
        TaskAnalytics analytics = taskStore.analytics(user.getUserId());
        StringBuilder context = new StringBuilder()
                .append("The user has ").append(analytics.pending() + analytics.inProgress())
                .append(" active tasks and ").append(analytics.completed()).append(" completed tasks.");
        if (!user.getGoals().isEmpty()) {
            context.append(" Goals: ").append(user.getGoals().stream()
                    .map(goal -> goal.label())
                    .collect(Collectors.joining(", "))).append('.');
        }
        List<DailySummary> recent = summaryRepository.findTop5ByOwnerIdOrderBySummaryDateDesc(user.getUserId());
        if (!recent.isEmpty()) {
            context.append(" Recent activity: ").append(recent.stream()
                    .map(summary -> summary.getSummaryDate() + ": " + summary.getProductivityLevel().value()
                            + " productivity")
                    .collect(Collectors.joining("; "))).append('.');
        }
        return context.toString();
    }
}
