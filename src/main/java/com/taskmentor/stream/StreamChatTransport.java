package com.taskmentor.stream;

import com.taskmentor.entity.NotificationType;
import com.taskmentor.tracker.ChatTransport;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Delivers chat replies and notifications over the user's WebSocket channel.
 */
@Component
public class StreamChatTransport implements ChatTransport {

    private final NotificationStreamHub hub;

    public StreamChatTransport(NotificationStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void send(String userId, String text) {
        hub.emit(userId, "message", Map.of("text", text));
    }

    @Override
    public void notify(String userId, NotificationType type, String text) {
        hub.emit(userId, "notification", Map.of(
                "type", type.settingKey(),
                "text", text
        ));
    }
}
