package com.taskmentor.tracker.intent;

public enum MatchTier {
    SUBSTRING,
    ALL_WORDS,
    FOLDED
}
