package com.taskmentor.api;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import com.taskmentor.tracker.UserLockRegistry;
import com.taskmentor.tracker.task.TaskStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
@Import(UserLockRegistry.class)
class TaskControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 10, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskStore taskStore;

    private Task task(String title, TaskStatus status) {
        return Task.builder()
                .id(UUID.randomUUID())
                .ownerId("alice")
                .title(title)
                .priority(TaskPriority.MEDIUM)
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void testCreateReturnsCreated() throws Exception {
        Task created = task("Buy milk", TaskStatus.PENDING);
        when(taskStore.create(eq("alice"), eq("Buy milk"), isNull(), eq(TaskPriority.HIGH), isNull()))
                .thenReturn(OperationResult.success(created));

        mockMvc.perform(post("/api/users/alice/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Buy milk\",\"priority\":\"high\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(created.getId().toString()))
                .andExpect(jsonPath("$.title").value("Buy milk"))
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    void testCreateWithBlankTitleIsRejected() throws Exception {
        mockMvc.perform(post("/api/users/alice/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\" \"}"))
                .andExpect(status().isBadRequest());

        verify(taskStore, never()).create(any(), any(), any(), any(), any());
    }

    @Test
    void testListFiltersByStatus() throws Exception {
        when(taskStore.list("alice", TaskStatus.COMPLETED)).thenReturn(List.of(task("Done", TaskStatus.COMPLETED)));

        mockMvc.perform(get("/api/users/alice/tasks").param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Done"));
    }

    @Test
    void testListWithUnknownStatusIsRejected() throws Exception {
        mockMvc.perform(get("/api/users/alice/tasks").param("status", "someday"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUpdateStatusOfMissingTaskIsNotFound() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskStore.updateStatus(taskId, "alice", TaskStatus.COMPLETED))
                .thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "Task not found."));

        mockMvc.perform(patch("/api/users/alice/tasks/{taskId}/status", taskId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUpdateWithUnknownStatusIsRejected() throws Exception {
        mockMvc.perform(patch("/api/users/alice/tasks/{taskId}/status", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"someday\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testDeleteReturnsNoContent() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskStore.delete(taskId, "alice")).thenReturn(OperationResult.success(true));

        mockMvc.perform(delete("/api/users/alice/tasks/{taskId}", taskId))
                .andExpect(status().isNoContent());

        verify(taskStore).delete(taskId, "alice");
    }
}
