package com.taskmentor.tracker;

public record ChatReply(
        String userId,
        String text,
        Route route
) {
}
