package com.taskmentor.tracker.task;

import com.taskmentor.config.TaskMentorProperties;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.repository.NotificationDispatchRepository;
import com.taskmentor.repository.TaskRepository;
import com.taskmentor.repository.TrackerUserRepository;
import com.taskmentor.tracker.ChatTransport;
import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import com.taskmentor.tracker.notification.NotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class JpaTaskStorePersistenceFailureTest {

    private final TaskRepository taskRepository = mock(TaskRepository.class);
    private final NotificationService notificationService = mock(NotificationService.class);
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
    private JpaTaskStore taskStore;

    @BeforeEach
    void setUp() {
        taskStore = new JpaTaskStore(taskRepository, notificationService, clock);
    }

    @Test
    void testCreateReportsPersistenceFailureWithoutNotice() {
        when(taskRepository.save(any(Task.class))).thenThrow(new DataAccessResourceFailureException("down"));

        OperationResult<Task> result = taskStore.create("alice", "Buy milk", null, null, null);

        assertTrue(result.is(ErrorKind.PERSISTENCE));
        verify(notificationService, never()).notifyNewTask(anyString(), any());
    }

    @Test
    void testFailedStatusUpdateRestoresEntity() {
        UUID id = UUID.randomUUID();
        OffsetDateTime created = OffsetDateTime.now(clock).minusDays(1);
        Task task = Task.builder()
                .id(id)
                .ownerId("alice")
                .title("Buy milk")
                .priority(TaskPriority.MEDIUM)
                .status(TaskStatus.PENDING)
                .createdAt(created)
                .updatedAt(created)
                .build();
        when(taskRepository.findByIdAndOwnerId(id, "alice")).thenReturn(Optional.of(task));
        when(taskRepository.save(task)).thenThrow(new DataAccessResourceFailureException("down"));

        OperationResult<Task> result = taskStore.updateStatus(id, "alice", TaskStatus.COMPLETED);

        assertTrue(result.is(ErrorKind.PERSISTENCE));
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertNull(task.getCompletedAt());
        assertEquals(created, task.getUpdatedAt());
    }

    @Test
    void testCreateSucceedsWhenNoticeLookupFails() {
        TrackerUserRepository userRepository = mock(TrackerUserRepository.class);
        ChatTransport chatTransport = mock(ChatTransport.class);
        NotificationService notices = new NotificationService(taskRepository, userRepository,
                mock(NotificationDispatchRepository.class), chatTransport, new TaskFormatter(),
                new TaskMentorProperties(), clock);
        JpaTaskStore store = new JpaTaskStore(taskRepository, notices, clock);
        when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(userRepository.findById("alice")).thenThrow(new DataAccessResourceFailureException("down"));

        OperationResult<Task> result = store.create("alice", "Buy milk", null, null, null);

        assertTrue(result.isSuccess());
        assertEquals("Buy milk", result.value().getTitle());
        verify(chatTransport, never()).notify(anyString(), any(), anyString());
    }
}
