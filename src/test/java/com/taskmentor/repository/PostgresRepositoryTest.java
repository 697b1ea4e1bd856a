package com.taskmentor.repository;

import com.taskmentor.entity.DialogueTurn;
import com.taskmentor.entity.TrackerGoal;
import com.taskmentor.entity.TrackerUser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the schema against a real PostgreSQL. Skipped when Docker is not available.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class PostgresRepositoryTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private TrackerUserRepository userRepository;

    @Test
    void testUserStateRoundTrip() {
        TrackerUser user = TrackerUser.builder().userId("pg-user").build();
        user.getGoals().add(TrackerGoal.PRODUCTIVITY);
        user.getAnxietyAnswers().add(3);
        user.getRecentDialogue().add(new DialogueTurn(DialogueTurn.ROLE_USER, "hello",
                OffsetDateTime.of(2026, 3, 2, 10, 0, 0, 0, ZoneOffset.UTC)));
        userRepository.saveAndFlush(user);

        TrackerUser found = userRepository.findById("pg-user").orElseThrow();
        assertTrue(found.getGoals().contains(TrackerGoal.PRODUCTIVITY));
        assertEquals(1, found.getRecentDialogue().size());
        assertEquals("UTC", found.getTimezone());
        assertFalse(found.isOnboardingComplete());
    }
}
