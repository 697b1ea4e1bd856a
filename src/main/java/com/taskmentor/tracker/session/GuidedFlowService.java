package com.taskmentor.tracker.session;

import com.taskmentor.entity.EveningSessionState;
import com.taskmentor.entity.OnboardingStep;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Fixed, forward-only step graphs shared by onboarding and the evening reflection.
 */
@Service
public class GuidedFlowService {

    private static final List<FlowStep> ONBOARDING_STEPS = List.of(
            new FlowStep("greeting", "Greeting", false),
            new FlowStep("anxiety_intro", "Anxiety check intro", false),
            new FlowStep("anxiety_survey", "Anxiety survey", false),
            new FlowStep("goal_selection", "Goal selection", false),
            new FlowStep("notification_setup", "Notification setup", false),
            new FlowStep("mentor_intro", "Meet the mentor", false),
            new FlowStep("completion", "Completion", false),
            new FlowStep("completed", "Completed", true)
    );

    private static final List<FlowStep> REFLECTION_STEPS = List.of(
            new FlowStep("starting", "Starting", false),
            new FlowStep("task_review", "Task review", false),
            new FlowStep("gratitude", "Gratitude", false),
            new FlowStep("summary", "Summary", false),
            new FlowStep("completed", "Completed", true)
    );

    public List<FlowStep> stepsFor(GuidedFlow flow) {
        if (flow == null) {
            throw new IllegalArgumentException("Flow is required");
        }
        return switch (flow) {
            case ONBOARDING -> ONBOARDING_STEPS;
            case REFLECTION -> REFLECTION_STEPS;
        };
    }

    /**
     * The step after {@code key}, or empty when {@code key} is terminal.
     */
    public Optional<FlowStep> next(GuidedFlow flow, String key) {
        List<FlowStep> steps = stepsFor(flow);
        int index = indexOf(steps, key);
        if (steps.get(index).terminal()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(index + 1));
    }

    /**
     * Whether moving from {@code from} to {@code to} keeps the flow moving forward.
     */
    public boolean isForward(GuidedFlow flow, String from, String to) {
        List<FlowStep> steps = stepsFor(flow);
        return indexOf(steps, to) > indexOf(steps, from);
    }

    public OnboardingStep advance(OnboardingStep step) {
        return next(GuidedFlow.ONBOARDING, step.key())
                .map(FlowStep::key)
                .map(OnboardingStep::fromKey)
                .orElse(step);
    }

    public EveningSessionState advance(EveningSessionState state) {
        return next(GuidedFlow.REFLECTION, state.key())
                .map(FlowStep::key)
                .map(EveningSessionState::fromKey)
                .orElse(state);
    }

    private int indexOf(List<FlowStep> steps, String key) {
        for (int index = 0; index < steps.size(); index++) {
            if (steps.get(index).key().equals(key)) {
                return index;
            }
        }
        throw new IllegalArgumentException("Unknown step: " + key);
    }
}
