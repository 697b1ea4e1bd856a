package com.taskmentor.repository;

import com.taskmentor.entity.DailySummary;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link DailySummary} entities.
 */
public interface DailySummaryRepository extends JpaRepository<DailySummary, UUID> {

    List<DailySummary> findByOwnerIdOrderBySummaryDateAsc(String ownerId);

    List<DailySummary> findTop5ByOwnerIdOrderBySummaryDateDesc(String ownerId);
}
