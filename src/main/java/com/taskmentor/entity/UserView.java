package com.taskmentor.entity;

public enum UserView {
    ONBOARDING,
    MAIN,
    TASKS,
    SETTINGS,
    REFLECTION
}
