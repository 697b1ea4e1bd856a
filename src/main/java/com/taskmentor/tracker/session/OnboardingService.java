package com.taskmentor.tracker.session;

import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.entity.NotificationSettings;
import com.taskmentor.entity.NotificationType;
import com.taskmentor.entity.OnboardingStep;
import com.taskmentor.entity.TrackerGoal;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.entity.UserView;
import com.taskmentor.tracker.MentorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static com.taskmentor.tracker.TrackerConstants.*;

/**
 * Drives the onboarding wizard. Each call consumes one turn (free text or a structured UI action)
 * and mutates the user in place; the caller persists it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OnboardingService {

    private static final Set<String> START_WORDS = Set.of("start", "yes", "y", "ok", "okay", "sure");
    private static final Set<String> SKIP_WORDS = Set.of("skip", "no", "n", "later");

    static final String GREETING_TEXT = """
            Hi! I'm your task mentor. I'll help you keep track of your tasks, reflect on your day \
            and stay calm about what's ahead. Let's set things up, it takes a minute.""";

    static final String COMPLETED_TEXT = """
            You're all set! Tell me what you need to do, for example "add task Buy milk", \
            ask "show my tasks", or start an evening reflection in the evening.""";

    private final GuidedFlowService flowService;
    private final MentorService mentorService;

    public String handle(TrackerUser user, @Nullable String text, @Nullable String action) {
        String input = normalize(text);
        String uiAction = action != null ? action.trim() : "";
        OnboardingStep step = user.getOnboardingStep();
        user.setCurrentView(UserView.ONBOARDING);
        return switch (step) {
            case GREETING -> {
                moveTo(user, OnboardingStep.ANXIETY_INTRO);
                yield GREETING_TEXT + "\n\n" + promptFor(user);
            }
            case ANXIETY_INTRO -> handleAnxietyIntro(user, input, uiAction);
            case ANXIETY_SURVEY -> handleSurvey(user, input, uiAction);
            case GOAL_SELECTION -> handleGoals(user, input, uiAction);
            case NOTIFICATION_SETUP -> handleNotifications(user, input, uiAction);
            case MENTOR_INTRO -> handleMentor(user, text, input, uiAction);
            case COMPLETION, COMPLETED -> finish(user);
        };
    }

    public String promptFor(TrackerUser user) {
        return switch (user.getOnboardingStep()) {
            case GREETING -> GREETING_TEXT;
            case ANXIETY_INTRO -> """
                    Before we start, a quick check of how your tasks make you feel: %d short statements, \
                    each rated from 1 (not at all) to 5 (very much).
                    Reply "start" to begin or "skip" to go straight to your goals.""".formatted(ANXIETY_STATEMENTS.size());
            case ANXIETY_SURVEY -> surveyQuestion(user.getAnxietyAnswers().size());
            case GOAL_SELECTION -> goalsPrompt(user);
            case NOTIFICATION_SETUP -> notificationsPrompt(user.getNotifications());
            case MENTOR_INTRO -> """
                    Meet your mentor: an assistant for planning, focus and motivation.
                    Say hi or ask anything. Reply "done" when you're ready to continue.""";
            case COMPLETION -> "Setup is almost finished. Reply anything to open your tracker.";
            case COMPLETED -> COMPLETED_TEXT;
        };
    }

    private String handleAnxietyIntro(TrackerUser user, String input, String action) {
        if (ACTION_ANXIETY_START.equals(action) || START_WORDS.contains(input)) {
            user.getAnxietyAnswers().clear();
            moveTo(user, OnboardingStep.ANXIETY_SURVEY);
            return promptFor(user);
        }
        if (ACTION_ANXIETY_SKIP.equals(action) || SKIP_WORDS.contains(input)) {
            moveTo(user, OnboardingStep.ANXIETY_SURVEY);
            moveTo(user, OnboardingStep.GOAL_SELECTION);
            return "No problem, we can do that another time.\n\n" + promptFor(user);
        }
        return promptFor(user);
    }

    private String handleSurvey(TrackerUser user, String input, String action) {
        List<Integer> answers = user.getAnxietyAnswers();
        Integer score = null;
        if (action.startsWith(ACTION_ANXIETY_ANSWER_PREFIX)) {
            String[] parts = action.substring(ACTION_ANXIETY_ANSWER_PREFIX.length()).split(":");
            if (parts.length == 2 && parseInt(parts[0]) == answers.size() + 1) {
                score = parseScore(parts[1]);
            }
        } else {
            score = parseScore(input);
        }
        if (score == null) {
            return "Please answer with a number from 1 to 5.\n\n" + promptFor(user);
        }
        answers.add(score);
        if (answers.size() < ANXIETY_STATEMENTS.size()) {
            return promptFor(user);
        }
        double level = answers.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        user.setAnxietyLevel(level);
        moveTo(user, OnboardingStep.GOAL_SELECTION);
        log.info("User {} finished the anxiety survey with level {}", user.getUserId(), level);
        return String.format(Locale.ROOT, "Thanks! Your task anxiety level is %.1f of 5. %s\n\n%s",
                level, anxietyComment(level), promptFor(user));
    }

    private String handleGoals(TrackerUser user, String input, String action) {
        if (isAdvance(input, action)) {
            moveTo(user, OnboardingStep.NOTIFICATION_SETUP);
            return promptFor(user);
        }
        String requested = action.startsWith(ACTION_GOAL_TOGGLE_PREFIX)
                ? action.substring(ACTION_GOAL_TOGGLE_PREFIX.length())
                : input;
        TrackerGoal goal = TrackerGoal.fromText(requested);
        if (goal == null) {
            return "I didn't recognize that goal.\n\n" + promptFor(user);
        }
        if (!user.getGoals().remove(goal)) {
            user.getGoals().add(goal);
        }
        return promptFor(user);
    }

    private String handleNotifications(TrackerUser user, String input, String action) {
        if (isAdvance(input, action)) {
            moveTo(user, OnboardingStep.MENTOR_INTRO);
            return promptFor(user);
        }
        String requested = action.startsWith(ACTION_NOTIFY_TOGGLE_PREFIX)
                ? action.substring(ACTION_NOTIFY_TOGGLE_PREFIX.length())
                : input.replace(' ', '_');
        NotificationSettings settings = user.getNotifications();
        if (NOTIFY_MASTER_SWITCH.equals(requested)) {
            settings.setEnabled(!settings.isEnabled());
            return promptFor(user);
        }
        NotificationType type = NotificationType.fromSettingKey(requested);
        if (type == null) {
            return "I didn't recognize that notification type.\n\n" + promptFor(user);
        }
        switch (type) {
            case DAILY_DIGEST -> settings.setDailyDigest(!settings.isDailyDigest());
            case DEADLINE_REMINDER -> settings.setDeadlineReminders(!settings.isDeadlineReminders());
            case NEW_TASK -> settings.setNewTaskNotices(!settings.isNewTaskNotices());
        }
        return promptFor(user);
    }

    private String handleMentor(TrackerUser user, @Nullable String rawText, String input, String action) {
        if (isAdvance(input, action)) {
            moveTo(user, OnboardingStep.COMPLETION);
            return promptFor(user);
        }
        user.setMetMentor(true);
        if (ACTION_MENTOR_MEET.equals(action) || !StringUtils.hasText(rawText)) {
            return FALLBACK_MENTOR + "\n\nReply \"done\" when you're ready to continue.";
        }
        String reply;
        try {
            reply = mentorService.introduce(user, rawText.trim());
        } catch (CompletionFailureException ex) {
            log.warn("Mentor introduction failed for {}: {}", user.getUserId(), ex.getMessage());
            reply = FALLBACK_MENTOR;
        }
        return reply + "\n\nReply \"done\" when you're ready to continue.";
    }

    private String finish(TrackerUser user) {
        if (user.getOnboardingStep() == OnboardingStep.COMPLETION) {
            moveTo(user, OnboardingStep.COMPLETED);
            log.info("User {} completed onboarding", user.getUserId());
        }
        user.setCurrentView(UserView.MAIN);
        return COMPLETED_TEXT;
    }

    private void moveTo(TrackerUser user, OnboardingStep target) {
        OnboardingStep current = user.getOnboardingStep();
        if (!flowService.isForward(GuidedFlow.ONBOARDING, current.key(), target.key())) {
            throw new IllegalStateException("Onboarding cannot move from " + current + " to " + target);
        }
        while (user.getOnboardingStep() != target) {
            user.setOnboardingStep(flowService.advance(user.getOnboardingStep()));
        }
    }

    private boolean isAdvance(String input, String action) {
        return ACTION_ONBOARDING_NEXT.equals(action) || ADVANCE_PHRASES.contains(input);
    }

    private String surveyQuestion(int index) {
        int position = Math.min(index, ANXIETY_STATEMENTS.size() - 1);
        return "Statement %d/%d: %s\nReply with a number from 1 (not at all) to 5 (very much)."
                .formatted(position + 1, ANXIETY_STATEMENTS.size(), ANXIETY_STATEMENTS.get(position));
    }

    private String goalsPrompt(TrackerUser user) {
        String options = Arrays.stream(TrackerGoal.values())
                .map(goal -> "- " + goal.key() + (user.getGoals().contains(goal) ? " [selected]" : ""))
                .collect(Collectors.joining("\n"));
        return "What would you like to work on? Name a goal to toggle it:\n" + options
                + "\nReply \"done\" when finished.";
    }

    private String notificationsPrompt(NotificationSettings settings) {
        return "Notifications (name one to toggle it):\n"
                + "- enabled: " + onOff(settings.isEnabled()) + "\n"
                + "- daily_digest: " + onOff(settings.isDailyDigest()) + "\n"
                + "- deadline_reminders: " + onOff(settings.isDeadlineReminders()) + "\n"
                + "- new_task_notices: " + onOff(settings.isNewTaskNotices()) + "\n"
                + "Reply \"done\" when finished.";
    }

    private String anxietyComment(double level) {
        if (level >= 4.0) {
            return "Tasks weigh on you quite a bit; we'll keep things small and manageable.";
        }
        if (level >= 2.5) {
            return "A moderate level; a clear plan usually helps a lot.";
        }
        return "You seem fairly relaxed about your tasks, great starting point.";
    }

    private static String onOff(boolean value) {
        return value ? "on" : "off";
    }

    private static String normalize(@Nullable String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("[.!]+$", "");
    }

    private static @Nullable Integer parseScore(String value) {
        int score = parseInt(value);
        return score >= 1 && score <= 5 ? score : null;
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
