package com.taskmentor.tracker;

/**
 * Which part of the tracker produced a reply.
 */
public enum Route {
    DUPLICATE,
    ONBOARDING,
    REFLECTION,
    CONFIRMATION,
    TASK,
    ADVICE,
    FALLBACK
}
