package com.taskmentor.repository;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link Task} entities. Every lookup is scoped by owner.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    List<Task> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<Task> findByOwnerIdAndStatusOrderByCreatedAtDesc(String ownerId, TaskStatus status);

    Optional<Task> findByIdAndOwnerId(UUID id, String ownerId);

    long countByOwnerId(String ownerId);

    List<Task> findByOwnerIdAndStatusInAndDueAtLessThanEqualOrderByDueAtAsc(String ownerId,
                                                                           Collection<TaskStatus> statuses,
                                                                           OffsetDateTime dueBefore);

    List<Task> findByOwnerIdAndStatusAndCompletedAtGreaterThanEqual(String ownerId,
                                                                   TaskStatus status,
                                                                   OffsetDateTime completedSince);
}
