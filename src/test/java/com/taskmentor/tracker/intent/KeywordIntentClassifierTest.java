package com.taskmentor.tracker.intent;

import com.taskmentor.entity.TaskPriority;
import com.taskmentor.entity.TaskStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordIntentClassifierTest {

    private final KeywordIntentClassifier classifier = new KeywordIntentClassifier();

    @Test
    void testCreate() {
        IntentReply reply = classifier.classify("add task Buy milk");
        assertEquals(IntentAction.CREATE, reply.action());
        assertEquals("Buy milk", reply.title());

        assertEquals("call mom", classifier.classify("remind me to call mom").title());
        assertEquals("taskforce meeting", classifier.classify("add taskforce meeting").title());
        assertEquals("Pay rent", classifier.classify("new task: Pay rent").title());
    }

    @Test
    void testDelete() {
        IntentReply reply = classifier.classify("delete milk");
        assertEquals(IntentAction.DELETE, reply.action());
        assertEquals("milk", reply.searchPhrase());

        assertEquals("report", classifier.classify("remove the report task").searchPhrase());
    }

    @Test
    void testStatusUpdates() {
        IntentReply done = classifier.classify("mark milk as done");
        assertEquals(IntentAction.UPDATE, done.action());
        assertEquals(TaskStatus.COMPLETED, done.targetStatus());
        assertEquals("milk", done.searchPhrase());

        IntentReply started = classifier.classify("start report");
        assertEquals(TaskStatus.IN_PROGRESS, started.targetStatus());
        assertEquals("report", started.searchPhrase());

        assertEquals(TaskStatus.CANCELLED, classifier.classify("cancel gym").targetStatus());
    }

    @Test
    void testPriorityUpdate() {
        IntentReply reply = classifier.classify("set report priority to high");
        assertEquals(IntentAction.UPDATE, reply.action());
        assertEquals(TaskPriority.HIGH, reply.targetPriority());
        assertEquals("report", reply.searchPhrase());
    }

    @Test
    void testViewStatsAndReflect() {
        assertEquals(IntentAction.VIEW, classifier.classify("show my tasks").action());
        assertEquals(IntentAction.STATS, classifier.classify("show stats").action());
        assertEquals(IntentAction.REFLECT, classifier.classify("let's start the evening reflection").action());
    }

    @Test
    void testTaskCommandsWinOverReflectAndStatsWords() {
        IntentReply created = classifier.classify("add task write reflection essay");
        assertEquals(IntentAction.CREATE, created.action());
        assertEquals("write reflection essay", created.title());

        IntentReply deleted = classifier.classify("delete the stats dashboard task");
        assertEquals(IntentAction.DELETE, deleted.action());
        assertEquals("stats dashboard", deleted.searchPhrase());

        IntentReply finished = classifier.classify("finish analytics report");
        assertEquals(IntentAction.UPDATE, finished.action());
        assertEquals(TaskStatus.COMPLETED, finished.targetStatus());

        assertEquals(IntentAction.REFLECT, classifier.classify("start my evening review").action());
    }

    @Test
    void testUnknown() {
        assertEquals(IntentAction.UNKNOWN, classifier.classify("hello there").action());
        assertEquals(IntentAction.UNKNOWN, classifier.classify(null).action());
        assertEquals(IntentAction.UNKNOWN, classifier.classify("yes").action());
    }
}
