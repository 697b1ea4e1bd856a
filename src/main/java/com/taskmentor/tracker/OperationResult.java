package com.taskmentor.tracker;

import org.springframework.lang.Nullable;

/**
 * Outcome of a tracker operation. Expected conditions such as a missing task or an invalid
 * field travel as values instead of exceptions.
 */
public record OperationResult<T>(
        @Nullable T value,
        @Nullable ErrorKind errorKind,
        @Nullable String message
) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind errorKind, String message) {
        return new OperationResult<>(null, errorKind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean is(ErrorKind kind) {
        return errorKind == kind;
    }
}
