package com.taskmentor.api;

import com.taskmentor.tracker.ChatReply;
import com.taskmentor.tracker.Route;

import java.time.Instant;

public record ChatResponse(
        String userId,
        String reply,
        Route route,
        Instant createdAt
) {

    public static ChatResponse from(ChatReply reply) {
        return new ChatResponse(reply.userId(), reply.text(), reply.route(), Instant.now());
    }
}
