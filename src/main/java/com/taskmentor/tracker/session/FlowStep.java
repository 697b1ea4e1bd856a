package com.taskmentor.tracker.session;

public record FlowStep(
        String key,
        String label,
        boolean terminal
) {
}
