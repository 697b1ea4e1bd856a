package com.taskmentor.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Server-push endpoint. Clients connect with {@code ?userId=<id>&since=<lastEventId>}; inbound
 * frames are ignored, chat goes through the REST endpoint.
 */
@Component
public class NotificationStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(NotificationStreamWebSocketHandler.class);

    private final NotificationStreamHub hub;

    public NotificationStreamWebSocketHandler(NotificationStreamHub hub) {
        this.hub = hub;
    }

    record Subscription(String userId, long lastSeenId) {
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Optional<Subscription> subscription = parseSubscription(session.getUri());
        if (subscription.isEmpty()) {
            log.debug("Rejecting stream session {} without a userId", session.getId());
            session.close(CloseStatus.BAD_DATA.withReason("userId is required"));
            return;
        }
        hub.registerSession(subscription.get().userId(), session, subscription.get().lastSeenId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on stream session {}: {}", session.getId(), exception.getMessage());
        hub.removeSession(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSession(session);
    }

    static Optional<Subscription> parseSubscription(@Nullable URI uri) {
        if (uri == null) {
            return Optional.empty();
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build(true)
                .getQueryParams();
        String userId = decode(params.getFirst("userId"));
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return Optional.of(new Subscription(userId, parseEventId(params.getFirst("since"))));
    }

    private static long parseEventId(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            log.debug("Ignoring invalid since parameter {}", value);
            return 0L;
        }
    }

    private static @Nullable String decode(@Nullable String value) {
        return value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : null;
    }
}
