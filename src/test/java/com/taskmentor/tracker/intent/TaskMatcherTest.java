package com.taskmentor.tracker.intent;

import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TaskMatcherTest {

    private final TaskMatcher matcher = new TaskMatcher();

    @Test
    void testTitleSubstringMatch() {
        List<TaskMatch> matches = matcher.match("MILK", List.of(task("Buy milk", ""), task("Call mom", "")));

        assertEquals(1, matches.size());
        assertEquals("Buy milk", matches.get(0).task().getTitle());
        assertEquals(1.0, matches.get(0).confidence());
        assertEquals(MatchTier.SUBSTRING, matches.get(0).tier());
    }

    @Test
    void testDescriptionOnlyMatchRanksBelowTitle() {
        List<TaskMatch> matches = matcher.match("milk",
                List.of(task("Groceries", "milk and eggs"), task("Buy milk", "")));

        assertEquals(2, matches.size());
        assertEquals("Buy milk", matches.get(0).task().getTitle());
        assertEquals(0.9, matches.get(1).confidence());
    }

    @Test
    void testAllWordsTierForMultiWordPhrase() {
        List<TaskMatch> matches = matcher.match("report quarterly",
                List.of(task("Write quarterly report", ""), task("Quarterly planning", "")));

        assertEquals(1, matches.size());
        assertEquals(MatchTier.ALL_WORDS, matches.get(0).tier());
        assertEquals(0.75, matches.get(0).confidence());
    }

    @Test
    void testFoldedTierHandlesInflections() {
        List<TaskMatch> matches = matcher.match("reports", List.of(task("Write report", "")));
        assertEquals(1, matches.size());
        assertEquals(MatchTier.FOLDED, matches.get(0).tier());
        assertEquals(0.6, matches.get(0).confidence());

        assertEquals(1, matcher.match("reading", List.of(task("Read book", ""))).size());
    }

    @Test
    void testFirstTierWithMatchesWins() {
        List<TaskMatch> matches = matcher.match("cleaned",
                List.of(task("Cleaned garage", ""), task("Clean kitchen", "")));

        assertEquals(1, matches.size());
        assertEquals("Cleaned garage", matches.get(0).task().getTitle());
    }

    @Test
    void testNoMatchOrEmptyPhrase() {
        List<Task> tasks = List.of(task("Buy milk", ""));
        assertTrue(matcher.match("dragons", tasks).isEmpty());
        assertTrue(matcher.match("  ", tasks).isEmpty());
        assertTrue(matcher.match("milk", List.of()).isEmpty());
    }

    @Test
    void testFold() {
        assertEquals("story", TaskMatcher.fold("stories"));
        assertEquals("box", TaskMatcher.fold("boxes"));
        assertEquals("watch", TaskMatcher.fold("watches"));
        assertEquals("clean", TaskMatcher.fold("cleaned"));
        assertEquals("class", TaskMatcher.fold("class"));
        assertEquals("bus", TaskMatcher.fold("bus"));
        assertEquals("sing", TaskMatcher.fold("sing"));
    }

    static Task task(String title, String description) {
        return Task.builder()
                .id(UUID.randomUUID())
                .ownerId("alice")
                .title(title)
                .description(description)
                .priority(TaskPriority.MEDIUM)
                .status(TaskStatus.PENDING)
                .build();
    }
}
