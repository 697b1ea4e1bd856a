package com.taskmentor.tracker;

import org.springframework.lang.Nullable;

/**
 * One message from the chat channel. {@code action} carries structured UI input such as
 * {@code goal:toggle:productivity}; {@code messageId} lets a resent message be recognized.
 */
public record InboundMessage(
        String userId,
        @Nullable String text,
        @Nullable String action,
        @Nullable String messageId
) {

    public static InboundMessage text(String userId, String text) {
        return new InboundMessage(userId, text, null, null);
    }
}
