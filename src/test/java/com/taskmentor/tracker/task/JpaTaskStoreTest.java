package com.taskmentor.tracker.task;

import com.taskmentor.BaseRepositoryTest;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.repository.TaskRepository;
import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JpaTaskStoreTest extends BaseRepositoryTest {

    @Autowired
    private TaskStore taskStore;

    @Autowired
    private TaskRepository taskRepository;

    @Test
    void testCreateAppliesDefaults() {
        OperationResult<Task> result = taskStore.create("alice", "  Buy milk  ", null, null, null);

        assertTrue(result.isSuccess());
        Task task = result.value();
        assertNotNull(task.getId());
        assertEquals("Buy milk", task.getTitle());
        assertEquals("", task.getDescription());
        assertEquals(TaskPriority.MEDIUM, task.getPriority());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(OffsetDateTime.now(clock), task.getCreatedAt());
        assertNull(task.getCompletedAt());
    }

    @Test
    void testCreateRejectsBlankAndOverlongTitles() {
        assertTrue(taskStore.create("alice", "   ", null, null, null).is(ErrorKind.VALIDATION));
        assertTrue(taskStore.create("alice", "x".repeat(501), null, null, null).is(ErrorKind.VALIDATION));
        assertTrue(taskStore.create(" ", "Title", null, null, null).is(ErrorKind.VALIDATION));
        assertEquals(0, taskRepository.countByOwnerId("alice"));
    }

    @Test
    void testForeignOwnerGetsNotFoundAndNothingChanges() {
        Task task = taskStore.create("alice", "Private task", null, TaskPriority.LOW, null).value();

        assertTrue(taskStore.updateStatus(task.getId(), "bob", TaskStatus.COMPLETED).is(ErrorKind.NOT_FOUND));
        assertTrue(taskStore.updatePriority(task.getId(), "bob", TaskPriority.URGENT).is(ErrorKind.NOT_FOUND));
        assertTrue(taskStore.delete(task.getId(), "bob").is(ErrorKind.NOT_FOUND));

        Task reloaded = taskStore.find(task.getId(), "alice").orElseThrow();
        assertEquals(TaskStatus.PENDING, reloaded.getStatus());
        assertEquals(TaskPriority.LOW, reloaded.getPriority());
    }

    @Test
    void testUnknownIdIsNotFound() {
        assertTrue(taskStore.delete(UUID.randomUUID(), "alice").is(ErrorKind.NOT_FOUND));
    }

    @Test
    void testCompletedAtFollowsStatus() {
        Task task = taskStore.create("alice", "Write report", null, null, null).value();
        clock.advance(Duration.ofHours(1));

        Task completed = taskStore.updateStatus(task.getId(), "alice", TaskStatus.COMPLETED).value();
        assertEquals(OffsetDateTime.now(clock), completed.getCompletedAt());
        assertEquals(OffsetDateTime.now(clock), completed.getUpdatedAt());

        Task reopened = taskStore.updateStatus(task.getId(), "alice", TaskStatus.IN_PROGRESS).value();
        assertNull(reopened.getCompletedAt());
    }

    @Test
    void testCreatesMinusDeletesMatchesAnalyticsTotal() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(taskStore.create("alice", "Task " + i, null, null, null).value().getId());
        }
        assertTrue(taskStore.delete(ids.get(0), "alice").isSuccess());
        assertTrue(taskStore.delete(ids.get(3), "alice").isSuccess());

        assertEquals(3, taskStore.list("alice", null).size());
        assertEquals(3, taskStore.analytics("alice").total());
    }

    @Test
    void testAnalyticsCountsAndRate() {
        Task first = taskStore.create("alice", "One", null, TaskPriority.HIGH, null).value();
        Task second = taskStore.create("alice", "Two", null, TaskPriority.HIGH, null).value();
        taskStore.create("alice", "Three", null, TaskPriority.LOW, null);
        taskStore.updateStatus(first.getId(), "alice", TaskStatus.COMPLETED);
        taskStore.updateStatus(second.getId(), "alice", TaskStatus.IN_PROGRESS);

        TaskAnalytics analytics = taskStore.analytics("alice");
        assertEquals(3, analytics.total());
        assertEquals(1, analytics.completed());
        assertEquals(1, analytics.inProgress());
        assertEquals(1, analytics.pending());
        assertEquals(33.33, analytics.completionRate());
        assertEquals(2L, analytics.priorityDistribution().get(TaskPriority.HIGH));
        assertEquals(0L, analytics.priorityDistribution().get(TaskPriority.URGENT));
    }

    @Test
    void testAnalyticsForEmptyOwner() {
        TaskAnalytics analytics = taskStore.analytics("nobody");
        assertEquals(0, analytics.total());
        assertEquals(0.0, analytics.completionRate());
    }

    @Test
    void testCompletionRateBounds() {
        assertEquals(0.0, JpaTaskStore.completionRate(0, 0));
        assertEquals(100.0, JpaTaskStore.completionRate(4, 4));
        assertEquals(100.0, JpaTaskStore.completionRate(7, 4));
        assertEquals(66.67, JpaTaskStore.completionRate(2, 3));
    }

    @Test
    void testUpcomingDeadlinesSoonestFirst() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        taskStore.create("alice", "Later", null, null, now.plusHours(20));
        taskStore.create("alice", "Overdue", null, null, now.minusHours(2));
        taskStore.create("alice", "Next week", null, null, now.plusDays(7));

        List<Task> upcoming = taskStore.upcomingDeadlines("alice", now, Duration.ofHours(24));
        assertEquals(List.of("Overdue", "Later"), upcoming.stream().map(Task::getTitle).toList());
    }
}
