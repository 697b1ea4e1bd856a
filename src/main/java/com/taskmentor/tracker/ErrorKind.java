package com.taskmentor.tracker;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    PERSISTENCE
}
