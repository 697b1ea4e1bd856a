package com.taskmentor.tracker.intent;

public enum IntentSource {
    MODEL,
    KEYWORD
}
