package com.taskmentor.repository;

import com.taskmentor.entity.EveningSession;
import com.taskmentor.entity.EveningSessionState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link EveningSession} entities.
 */
public interface EveningSessionRepository extends JpaRepository<EveningSession, UUID> {

    boolean existsByOwnerIdAndSessionDate(String ownerId, LocalDate sessionDate);

    Optional<EveningSession> findFirstByOwnerIdAndStateNotOrderBySessionDateDesc(String ownerId,
                                                                                 EveningSessionState state);
}
