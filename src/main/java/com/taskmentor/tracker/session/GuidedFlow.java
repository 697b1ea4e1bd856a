package com.taskmentor.tracker.session;

public enum GuidedFlow {
    ONBOARDING,
    REFLECTION
}
