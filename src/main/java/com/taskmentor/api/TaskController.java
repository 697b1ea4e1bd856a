package com.taskmentor.api;

import com.taskmentor.entity.TaskStatus;
import com.taskmentor.tracker.UserLockRegistry;
import com.taskmentor.tracker.task.TaskAnalytics;
import com.taskmentor.tracker.task.TaskStore;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/users/{userId}")
public class TaskController {

    private final TaskStore taskStore;
    private final UserLockRegistry lockRegistry;

    public TaskController(TaskStore taskStore, UserLockRegistry lockRegistry) {
        this.taskStore = taskStore;
        this.lockRegistry = lockRegistry;
    }

    @GetMapping("/tasks")
    public List<TaskResponse> list(@PathVariable String userId,
                                   @RequestParam(value = "status", required = false) String status) {
        TaskStatus filter = null;
        if (status != null) {
            filter = TaskStatus.fromValue(status);
            if (filter == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown status: " + status);
            }
        }
        return taskStore.list(userId, filter).stream()
                .map(TaskResponse::from)
                .toList();
    }

    @PostMapping("/tasks")
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse create(@PathVariable String userId, @Valid @RequestBody CreateTaskRequest request) {
        var result = lockRegistry.withLock(userId, () -> taskStore.create(userId, request.title(),
                request.description(), request.priority(), request.dueAt()));
        return TaskResponse.from(ApiResults.unwrap(result));
    }

    @PatchMapping("/tasks/{taskId}/status")
    public TaskResponse updateStatus(@PathVariable String userId, @PathVariable UUID taskId,
                                     @Valid @RequestBody UpdateStatusRequest request) {
        var result = lockRegistry.withLock(userId, () -> taskStore.updateStatus(taskId, userId, request.status()));
        return TaskResponse.from(ApiResults.unwrap(result));
    }

    @PatchMapping("/tasks/{taskId}/priority")
    public TaskResponse updatePriority(@PathVariable String userId, @PathVariable UUID taskId,
                                       @Valid @RequestBody UpdatePriorityRequest request) {
        var result = lockRegistry.withLock(userId,
                () -> taskStore.updatePriority(taskId, userId, request.priority()));
        return TaskResponse.from(ApiResults.unwrap(result));
    }

    @DeleteMapping("/tasks/{taskId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String userId, @PathVariable UUID taskId) {
        ApiResults.unwrap(lockRegistry.withLock(userId, () -> taskStore.delete(taskId, userId)));
    }

    @GetMapping("/analytics")
    public TaskAnalytics analytics(@PathVariable String userId) {
        return taskStore.analytics(userId);
    }
}
