package com.taskmentor.tracker;

import java.util.List;

public final class TrackerConstants {

    private TrackerConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM request purposes
    public static final String PURPOSE_INTENT = "intent";
    public static final String PURPOSE_ADVICE = "advice";
    public static final String PURPOSE_MENTOR_INTRO = "mentor-intro";
    public static final String PURPOSE_TASK_SUPPORT = "task-support";
    public static final String PURPOSE_HELP_OFFER = "help-offer";
    public static final String PURPOSE_TASK_HELP = "task-help";
    public static final String PURPOSE_GRATITUDE = "gratitude";
    public static final String PURPOSE_DAILY_SUMMARY = "daily-summary";

    // Structured UI actions
    public static final String ACTION_ONBOARDING_NEXT = "onboarding:next";
    public static final String ACTION_ANXIETY_START = "anxiety:start";
    public static final String ACTION_ANXIETY_SKIP = "anxiety:skip";
    public static final String ACTION_ANXIETY_ANSWER_PREFIX = "anxiety:answer:";
    public static final String ACTION_GOAL_TOGGLE_PREFIX = "goal:toggle:";
    public static final String ACTION_NOTIFY_TOGGLE_PREFIX = "notify:toggle:";
    public static final String ACTION_MENTOR_MEET = "mentor:meet";
    public static final String NOTIFY_MASTER_SWITCH = "enabled";

    // Phrase sets
    public static final List<String> AFFIRMATIVE_PHRASES = List.of(
            "yes", "y", "yeah", "yep", "confirm", "confirmed", "sure", "ok", "okay",
            "do it", "delete it", "go ahead");
    public static final List<String> CONFIRMATION_FILLER_WORDS = List.of(
            "please", "thanks", "thank", "you", "it", "now", "do", "go", "ahead", "delete", "that", "one");
    public static final List<String> NEGATION_WORDS = List.of(
            "no", "not", "nope", "nah", "don't", "dont", "wait", "cancel", "stop", "never", "hold", "undo");
    public static final List<String> NEGATIVE_OUTCOME_PHRASES = List.of(
            "nothing", "didn't", "did not", "not done", "no progress", "stuck", "problem", "couldn't", "failed");
    public static final List<String> ADVANCE_PHRASES = List.of("next", "done", "continue", "skip", "finish");

    // Keyword fallback vocabulary
    public static final List<String> REFLECT_PHRASES = List.of(
            "evening session", "evening review", "reflection", "reflect", "review my day", "end my day");
    public static final List<String> STATS_PHRASES = List.of(
            "statistics", "stats", "analytics", "progress report", "how am i doing", "completion rate");
    public static final List<String> DELETE_VERBS = List.of("delete ", "remove ", "erase ", "drop ");
    public static final List<String> CREATE_PREFIXES = List.of(
            "new task", "add ", "create ", "remind me to ", "i need to ");
    public static final List<String> COMPLETE_VERBS = List.of(
            "complete ", "completed ", "finish ", "finished ", "done with ", "close ");
    public static final List<String> COMPLETE_SUFFIXES = List.of(
            " as done", " as completed", " as complete", " as finished", " done", " completed");
    public static final List<String> START_VERBS = List.of("start ", "begin ", "started ", "working on ");
    public static final List<String> CANCEL_VERBS = List.of("cancel ", "abandon ");
    public static final List<String> VIEW_PHRASES = List.of(
            "show", "list", "my tasks", "view", "what are my tasks", "what do i have");
    public static final List<String> PHRASE_FILLER_WORDS = List.of(
            "task", "tasks", "the", "my", "a", "an", "as", "to", "of", "for", "mark", "set", "change",
            "priority", "please", "done", "completed", "complete", "finished", "in", "progress", "it");

    public static final List<String> ANXIETY_STATEMENTS = List.of(
            "I often feel overwhelmed by the number of things I need to do.",
            "I worry about missing deadlines.",
            "I find it hard to decide which task to start with.",
            "Unfinished tasks keep me up at night.",
            "I feel guilty when I rest instead of working.");

    // Fixed replies used when generation is unavailable
    public static final String FALLBACK_REPLY =
            "Sorry, I can't process that right now. Try \"show my tasks\" or \"add task <title>\".";
    public static final String FALLBACK_TASK_SUPPORT =
            "Thanks for sharing. Every step counts, even the small ones.";
    public static final String FALLBACK_HELP_OFFER =
            "That's completely normal, some days tasks just don't move. What got in the way?";
    public static final String FALLBACK_TASK_HELP =
            "Try splitting the task into one small step you can finish in 15 minutes, and start there tomorrow.";
    public static final String FALLBACK_GRATITUDE =
            "Thank you for taking a moment to appreciate yourself.";
    public static final String FALLBACK_SUMMARY =
            "You reviewed your day and took time to reflect. That is progress in itself.";
    public static final String FALLBACK_MENTOR =
            "I'm your mentor here. Ask me about planning, focus or motivation whenever you like.";
    public static final String HELP_OFFER_QUESTION = "\n\nHow can I help you with this task?";

    public static final String INTENT_SYSTEM_PROMPT = """
            You are the intent resolver of a personal task tracker.
            Classify the user's message into exactly one action:
            - create: add a new task (extract title, optional description and priority)
            - update: change the status or priority of an existing task
            - delete: remove an existing task
            - view: list tasks
            - stats: show task statistics
            - reflect: start the evening reflection session
            - unknown: anything else (general questions, advice, small talk)

            For update and delete, put the words that identify the task into "search_phrase" and,
            when you are sure, list matching ids from the registry in "task_ids". Never invent ids.
            Priorities: low, medium, high, urgent. Statuses: pending, in_progress, completed, cancelled.

            Return JSON only:
            {
              "action": "create|update|delete|view|stats|reflect|unknown",
              "search_phrase": "...",
              "task_ids": [{"task_id": "...", "confidence": 0.0, "reasoning": "..."}],
              "title": "...",
              "description": "...",
              "priority": "low|medium|high|urgent",
              "target_status": "pending|in_progress|completed|cancelled",
              "target_priority": "low|medium|high|urgent",
              "suggested_response": "..."
            }
            """;

    public static final String INTENT_USER_TEMPLATE = """
            Task registry:
            {tasks}

            Recent dialogue:
            {dialogue}

            User message:
            {input}
            """;

    public static final String MENTOR_SYSTEM_PROMPT = """
            You are the AI mentor of a productivity tracker. Help the user with motivation, planning,
            productivity strategies and emotional support.
            Be supportive and practical, focus on progress rather than perfection, keep answers short.
            """;

    public static final String MENTOR_USER_TEMPLATE = """
            User context: {context}

            Recent dialogue:
            {dialogue}

            User message: {input}
            """;

    public static final String REFLECTION_SYSTEM_PROMPT = """
            You are a warm, non-judgmental evening reflection coach. Answer in 2-3 sentences.
            """;

    public static final String TASK_SUPPORT_TEMPLATE = """
            The user described today's progress on the task "{task}": "{progress}".
            Write a short supportive reply that highlights the positive, even if the progress seems small.
            """;

    public static final String HELP_OFFER_TEMPLATE = """
            The user could not make progress on the task "{task}": "{progress}".
            Reply with empathy, make clear this is normal, and do not judge.
            """;

    public static final String TASK_HELP_TEMPLATE = """
            The user asks for help with the task "{task}": "{request}".
            Suggest 2-3 concrete, practical next steps.
            """;

    public static final String GRATITUDE_TEMPLATE = """
            The user is grateful to themselves for: "{gratitude}".
            Reply warmly and stress the value of acknowledging one's own achievements.
            """;

    public static final String DAILY_SUMMARY_TEMPLATE = """
            Write a short (3-4 sentences) positive and motivating summary of the user's day.

            Task review:
            {review}

            Gratitude: {gratitude}

            Stats: {withProgress} of {reviewed} tasks had progress.
            """;
}
