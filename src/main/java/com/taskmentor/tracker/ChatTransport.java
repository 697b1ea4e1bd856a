package com.taskmentor.tracker;

import com.taskmentor.entity.NotificationType;

/**
 * Outbound side of the chat channel. The core hands it plain text only.
 */
public interface ChatTransport {

    void send(String userId, String text);

    default void notify(String userId, NotificationType type, String text) {
        send(userId, text);
    }
}
