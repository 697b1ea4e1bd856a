package com.taskmentor.tracker;

import com.taskmentor.BaseRepositoryTest;
import com.taskmentor.completion.CompletionFailureException;
import com.taskmentor.entity.OnboardingStep;
import com.taskmentor.entity.Task;
import com.taskmentor.entity.TaskStatus;
import com.taskmentor.entity.TrackerUser;
import com.taskmentor.entity.UserView;
import com.taskmentor.repository.TrackerUserRepository;
import com.taskmentor.tracker.intent.IntentAction;
import com.taskmentor.tracker.intent.IntentReply;
import com.taskmentor.tracker.task.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static com.taskmentor.tracker.TrackerConstants.FALLBACK_REPLY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

class ConversationOrchestratorTest extends BaseRepositoryTest {

    private static final String USER = "alice";

    @Autowired
    private ConversationOrchestrator orchestrator;

    @Autowired
    private TaskStore taskStore;

    @Autowired
    private TrackerUserRepository userRepository;

    @BeforeEach
    void setUp() {
        userRepository.save(TrackerUser.builder()
                .userId(USER)
                .onboardingStep(OnboardingStep.COMPLETED)
                .currentView(UserView.MAIN)
                .build());
        doThrow(new CompletionFailureException("intent", "model unavailable")).when(completionService)
                .completeJson(anyString(), anyString(), anyString(), anyMap(), eq(IntentReply.class));
        doThrow(new CompletionFailureException("advice", "model unavailable")).when(completionService)
                .complete(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void testBuyMilkEndToEnd() {
        ChatReply created = say("add task Buy milk");
        assertEquals(Route.TASK, created.route());
        assertTrue(created.text().startsWith("Created task: [ ] Buy milk"));
        assertEquals(0.0, taskStore.analytics(USER).completionRate());

        ChatReply askDone = say("mark milk as done");
        assertTrue(askDone.text().startsWith("Mark this task as completed?"));
        assertEquals(TaskStatus.PENDING, onlyTask().getStatus());

        ChatReply done = say("yes");
        assertEquals(Route.CONFIRMATION, done.route());
        Task completed = onlyTask();
        assertEquals(TaskStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getCompletedAt());
        assertEquals(100.0, taskStore.analytics(USER).completionRate());

        ChatReply askDelete = say("delete milk");
        assertTrue(askDelete.text().startsWith("Delete this task?"));
        assertTrue(askDelete.text().contains(completed.getId().toString()));
        assertEquals(1, taskStore.list(USER, null).size());

        ChatReply deleted = say("yes");
        assertEquals("Deleted task: Buy milk", deleted.text());
        assertTrue(taskStore.list(USER, null).isEmpty());
    }

    @Test
    void testBareYesWithoutPendingDeletesNothing() {
        taskStore.create(USER, "Buy milk", null, null, null);

        ChatReply reply = say("yes");

        assertEquals(Route.FALLBACK, reply.route());
        assertEquals(FALLBACK_REPLY, reply.text());
        assertEquals(1, taskStore.list(USER, null).size());
    }

    @Test
    void testNegatedReplyDoesNotConfirmDelete() {
        taskStore.create(USER, "Buy milk", null, null, null);
        assertTrue(say("delete milk").text().startsWith("Delete this task?"));

        ChatReply reply = say("ok wait, no, don't delete it");

        assertNotEquals(Route.CONFIRMATION, reply.route());
        assertEquals(1, taskStore.list(USER, null).size());
        assertNull(user().getPendingConfirmation());
    }

    @Test
    void testSeveralMatchesAskForNarrowerPhrase() {
        taskStore.create(USER, "Write report", null, null, null);
        taskStore.create(USER, "Read report", null, null, null);
        taskStore.create(USER, "Report taxes", null, null, null);

        ChatReply reply = say("delete report");

        assertTrue(reply.text().startsWith("Several tasks match \"report\":"));
        assertTrue(reply.text().endsWith("Please use a more specific phrase."));
        assertNull(user().getPendingConfirmation());

        say("yes");
        assertEquals(3, taskStore.list(USER, null).size());
    }

    @Test
    void testNoMatchListsSuggestions() {
        taskStore.create(USER, "Buy milk", null, null, null);

        ChatReply reply = say("delete dragons");

        assertTrue(reply.text().startsWith("I couldn't find a task matching \"dragons\"."));
        assertTrue(reply.text().contains("- Buy milk"));
        assertEquals(1, taskStore.list(USER, null).size());
    }

    @Test
    void testNonAffirmativeClearsPendingConfirmation() {
        taskStore.create(USER, "Buy milk", null, null, null);
        say("delete milk");
        assertNotNull(user().getPendingConfirmation());

        say("show my tasks");
        assertNull(user().getPendingConfirmation());

        say("yes");
        assertEquals(1, taskStore.list(USER, null).size());
    }

    @Test
    void testExpiredConfirmationIsNotExecuted() {
        taskStore.create(USER, "Buy milk", null, null, null);
        say("delete milk");

        clock.advance(Duration.ofMinutes(11));
        ChatReply reply = say("yes");

        assertNotEquals(Route.CONFIRMATION, reply.route());
        assertEquals(1, taskStore.list(USER, null).size());
    }

    @Test
    void testResentMessageIsNotExecutedTwice() {
        ChatReply first = orchestrator.handle(new InboundMessage(USER, "add task Buy milk", null, "msg-1"));
        ChatReply second = orchestrator.handle(new InboundMessage(USER, "add task Buy milk", null, "msg-1"));

        assertEquals(Route.DUPLICATE, second.route());
        assertEquals(first.text(), second.text());
        assertEquals(1, taskStore.list(USER, null).size());
    }

    @Test
    void testViewAndStats() {
        taskStore.create(USER, "Buy milk", null, null, null);

        ChatReply view = say("show my tasks");
        assertEquals("Your tasks:\n1. [ ] Buy milk (medium)", view.text());
        assertEquals(UserView.TASKS, user().getCurrentView());

        ChatReply stats = say("show stats");
        assertTrue(stats.text().contains("Total: 1"));
        assertTrue(stats.text().contains("Completion rate: 0.0%"));
    }

    @Test
    void testModelIntentIsUsedWhenAvailable() {
        doReturn(new IntentReply(IntentAction.CREATE, null, List.of(), "Call mom", "about Sunday",
                null, null, null, null))
                .when(completionService).completeJson(anyString(), anyString(), anyString(), anyMap(),
                        eq(IntentReply.class));

        ChatReply reply = say("I should really call my mother");

        assertTrue(reply.text().startsWith("Created task: [ ] Call mom"));
        assertEquals("about Sunday", taskStore.list(USER, null).get(0).getDescription());
    }

    @Test
    void testReflectionOwnsTurnsUntilFinished() {
        doReturn("generated").when(completionService).complete(anyString(), anyString(), anyString(), anyMap());
        taskStore.create(USER, "Write report", null, null, null);

        ChatReply opening = say("start my evening reflection");
        assertEquals(Route.REFLECTION, opening.route());
        assertEquals(UserView.REFLECTION, user().getCurrentView());

        assertTrue(say("delete report").text().startsWith("Task 1/1"));
        say("wrote the intro");
        ChatReply last = say("my patience");
        assertEquals(Route.REFLECTION, last.route());
        assertTrue(last.text().contains("Daily summary"));
        assertEquals(UserView.MAIN, user().getCurrentView());
        assertEquals(1, taskStore.list(USER, null).size());

        ChatReply again = say("start my evening reflection");
        assertTrue(again.text().startsWith("You already had an evening session today."));
    }

    @Test
    void testReflectionContinuesAcrossMidnight() {
        doReturn("generated").when(completionService).complete(anyString(), anyString(), anyString(), anyMap());
        taskStore.create(USER, "Write report", null, null, null);
        say("start my evening reflection");
        assertTrue(say("ready").text().startsWith("Task 1/1"));

        clock.advance(Duration.ofDays(1));

        ChatReply review = say("wrote the intro");
        assertEquals(Route.REFLECTION, review.route());
        ChatReply last = say("my patience");
        assertEquals(Route.REFLECTION, last.route());
        assertTrue(last.text().contains("Daily summary"));
        assertEquals(UserView.MAIN, user().getCurrentView());
    }

    @Test
    void testNewUserStartsOnboarding() {
        ChatReply reply = orchestrator.handle(InboundMessage.text("newcomer", "hello"));

        assertEquals(Route.ONBOARDING, reply.route());
        assertEquals(OnboardingStep.ANXIETY_INTRO, userRepository.findById("newcomer").orElseThrow().getOnboardingStep());
        verify(chatTransport).send("newcomer", reply.text());
    }

    @Test
    void testDialogueHistoryIsBounded() {
        for (int i = 0; i < 15; i++) {
            say("hello " + i);
        }
        assertEquals(20, user().getRecentDialogue().size());
    }

    private ChatReply say(String text) {
        return orchestrator.handle(InboundMessage.text(USER, text));
    }

    private TrackerUser user() {
        return userRepository.findById(USER).orElseThrow();
    }

    private Task onlyTask() {
        List<Task> tasks = taskStore.list(USER, null);
        assertEquals(1, tasks.size());
        return tasks.get(0);
    }
}
