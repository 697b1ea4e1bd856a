package com.taskmentor.api;

import com.taskmentor.entity.NotificationSettings;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.tracker.ConversationContextService;
import com.taskmentor.tracker.UserLockRegistry;
import com.taskmentor.tracker.session.ReflectionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}")
public class SettingsController {

    private final ConversationContextService contextService;
    private final ReflectionService reflectionService;
    private final UserLockRegistry lockRegistry;

    public SettingsController(ConversationContextService contextService, ReflectionService reflectionService,
                              UserLockRegistry lockRegistry) {
        this.contextService = contextService;
        this.reflectionService = reflectionService;
        this.lockRegistry = lockRegistry;
    }

    @GetMapping("/settings")
    public SettingsResponse getSettings(@PathVariable String userId) {
        return SettingsResponse.from(findUser(userId));
    }

    @PutMapping("/settings")
    public SettingsResponse updateSettings(@PathVariable String userId, @RequestBody UpdateSettingsRequest request) {
        if (request.timezone() != null) {
            try {
                ZoneId.of(request.timezone());
            } catch (DateTimeException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown timezone: " + request.timezone());
            }
        }
        TrackerUser updated = lockRegistry.withLock(userId, () -> {
            TrackerUser user = findUser(userId);
            NotificationSettings settings = user.getNotifications();
            if (request.timezone() != null) {
                user.setTimezone(request.timezone());
            }
            if (request.enabled() != null) {
                settings.setEnabled(request.enabled());
            }
            if (request.dailyDigest() != null) {
                settings.setDailyDigest(request.dailyDigest());
            }
            if (request.deadlineReminders() != null) {
                settings.setDeadlineReminders(request.deadlineReminders());
            }
            if (request.newTaskNotices() != null) {
                settings.setNewTaskNotices(request.newTaskNotices());
            }
            if (request.sendTime() != null) {
                settings.setSendTime(request.sendTime());
            }
            return contextService.save(user);
        });
        return SettingsResponse.from(updated);
    }

    @GetMapping("/summaries")
    public List<DailySummaryResponse> summaries(@PathVariable String userId) {
        return reflectionService.summaries(userId).stream()
                .map(DailySummaryResponse::from)
                .toList();
    }

    private TrackerUser findUser(String userId) {
        return contextService.find(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found."));
    }
}
