package com.taskmentor.tracker;

import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.DialogueTurn;
import com.taskmentor.entity.NotificationSettings;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.repository.TrackerUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Loads and stores per-user conversational state and keeps the dialogue history bounded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextService {

    private final TrackerUserRepository userRepository;
    private final TaskMentorProperties properties;
    private final Clock clock;

    public TrackerUser loadOrCreate(String userId) {
        return userRepository.findById(userId).orElseGet(() -> {
            log.info("Registering new tracker user {}", userId);
            TrackerUser user = TrackerUser.builder()
                    .userId(userId)
                    .notifications(NotificationSettings.builder()
                            .sendTime(properties.getNotifications().getDefaultSendTime())
                            .build())
                    .build();
            return userRepository.save(user);
        });
    }

    public Optional<TrackerUser> find(String userId) {
        return userRepository.findById(userId);
    }

    public TrackerUser save(TrackerUser user) {
        return userRepository.save(user);
    }

    public void appendDialogue(TrackerUser user, String role, String content) {
        List<DialogueTurn> history = user.getRecentDialogue();
        history.add(new DialogueTurn(role, content, now()));
        int limit = Math.max(1, properties.getDialogue().getHistoryLimit());
        while (history.size() > limit) {
            history.remove(0);
        }
    }

    /**
     * Renders the last few turns for a prompt.
     */
    public String dialogueWindow(TrackerUser user) {
        List<DialogueTurn> history = user.getRecentDialogue();
        int window = properties.getDialogue().getPromptWindow();
        List<DialogueTurn> recent = history.subList(Math.max(0, history.size() - window), history.size());
        if (recent.isEmpty()) {
            return "None.";
        }
        return recent.stream()
                .map(turn -> turn.getRole() + ": " + turn.getContent())
                .collect(Collectors.joining("\n"));
    }

    public ZoneId zoneOf(TrackerUser user) {
        if (!StringUtils.hasText(user.getTimezone())) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(user.getTimezone());
        } catch (DateTimeException ex) {
            log.warn("User {} has an invalid timezone {}; using UTC", user.getUserId(), user.getTimezone());
            return ZoneOffset.UTC;
        }
    }

    public LocalDate today(TrackerUser user) {
        return LocalDate.now(clock.withZone(zoneOf(user)));
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
