package com.taskmentor.repository;

import com.taskmentor.entity.OnboardingStep;
import com.taskmentor.entity.TrackerUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository interface for managing {@link TrackerUser} entities.
 */
public interface TrackerUserRepository extends JpaRepository<TrackerUser, String> {

    List<TrackerUser> findByOnboardingStep(OnboardingStep onboardingStep);
}
