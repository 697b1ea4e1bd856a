package com.taskmentor.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user push channels. Events are buffered so a client that reconnects with the last event id
 * it saw receives what it missed.
 */
@Component
public class NotificationStreamHub {
    private static final Logger log = LoggerFactory.getLogger(NotificationStreamHub.class);
    private static final String USER_ATTRIBUTE = "userId";
    private static final int REPLAY_CAPACITY = 200;
    private static final Duration IDLE_TTL = Duration.ofHours(24);

    private final ObjectMapper objectMapper;
    private final Map<String, UserChannel> channels = new ConcurrentHashMap<>();

    public NotificationStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Replays every buffered event newer than {@code lastSeenId}, then attaches the session for
     * live events. Events emitted meanwhile wait, so the session sees each id once and in order.
     */
    public void registerSession(String userId, WebSocketSession session, long lastSeenId) {
        dropIdleChannels();
        UserChannel channel = channel(userId);
        session.getAttributes().put(USER_ATTRIBUTE, userId);
        synchronized (channel) {
            List<StreamEvent> missed = channel.after(lastSeenId);
            if (!missed.isEmpty()) {
                log.debug("Replaying {} events to {} (session {})", missed.size(), userId, session.getId());
            }
            missed.forEach(event -> deliver(session, event));
            channel.attach(session);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object userId = session.getAttributes().get(USER_ATTRIBUTE);
        if (userId == null) {
            return;
        }
        UserChannel channel = channels.get(userId.toString());
        if (channel != null) {
            channel.detach(session.getId());
        }
    }

    public StreamEvent emit(String userId, String type, Object data) {
        UserChannel channel = channel(userId);
        synchronized (channel) {
            StreamEvent event = channel.append(type, data);
            channel.attachedSessions().forEach(session -> deliver(session, event));
            return event;
        }
    }

    public List<StreamEvent> eventsSince(String userId, long lastSeenId) {
        UserChannel channel = channels.get(userId);
        return channel != null ? channel.after(lastSeenId) : List.of();
    }

    private UserChannel channel(String userId) {
        return channels.computeIfAbsent(userId, id -> new UserChannel(REPLAY_CAPACITY));
    }

    private void deliver(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize {} event {}: {}", event.type(), event.id(), ex.getMessage());
            return;
        }
        try {
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to push event {} to session {}: {}", event.id(), session.getId(), ex.getMessage());
        }
    }

    private void dropIdleChannels() {
        Instant cutoff = Instant.now().minus(IDLE_TTL);
        channels.values().removeIf(channel -> channel.isIdleSince(cutoff));
    }
}
