package com.taskmentor.stream;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound state of one user: a bounded replay buffer with monotonically increasing event ids
 * and the WebSocket sessions currently attached. The channel's monitor orders replays against
 * live pushes.
 */
class UserChannel {
    private final int capacity;
    private final Deque<StreamEvent> replay = new ArrayDeque<>();
    private final Map<String, WebSocketSession> attached = new ConcurrentHashMap<>();
    private long lastEventId;
    private volatile Instant lastActivity = Instant.now();

    UserChannel(int capacity) {
        this.capacity = capacity;
    }

    void attach(WebSocketSession session) {
        attached.put(session.getId(), session);
        lastActivity = Instant.now();
    }

    void detach(String sessionId) {
        attached.remove(sessionId);
        lastActivity = Instant.now();
    }

    Collection<WebSocketSession> attachedSessions() {
        return attached.values();
    }

    synchronized StreamEvent append(String type, Object data) {
        Instant now = Instant.now();
        StreamEvent event = new StreamEvent(++lastEventId, now, type, data);
        replay.addLast(event);
        while (replay.size() > capacity) {
            replay.removeFirst();
        }
        lastActivity = now;
        return event;
    }

    synchronized List<StreamEvent> after(long eventId) {
        return replay.stream()
                .filter(event -> event.id() > eventId)
                .toList();
    }

    /**
     * A channel is idle when nobody is attached and nothing happened since {@code cutoff}.
     */
    boolean isIdleSince(Instant cutoff) {
        return attached.isEmpty() && lastActivity.isBefore(cutoff);
    }
}
