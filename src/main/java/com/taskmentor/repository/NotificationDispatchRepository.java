package com.taskmentor.repository;

import com.taskmentor.entity.NotificationDispatch;
import com.taskmentor.entity.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link NotificationDispatch} markers.
 */
public interface NotificationDispatchRepository extends JpaRepository<NotificationDispatch, UUID> {

    boolean existsByOwnerIdAndTypeAndDispatchKey(String ownerId, NotificationType type, String dispatchKey);
}
