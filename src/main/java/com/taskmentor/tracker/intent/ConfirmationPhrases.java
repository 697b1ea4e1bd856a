package com.taskmentor.tracker.intent;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.taskmentor.tracker.TrackerConstants.AFFIRMATIVE_PHRASES;
import static com.taskmentor.tracker.TrackerConstants.CONFIRMATION_FILLER_WORDS;
import static com.taskmentor.tracker.TrackerConstants.NEGATION_WORDS;

@Component
public class ConfirmationPhrases {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    /**
     * True when the text is an affirmative phrase followed by nothing but filler words or a task id
     * ("yes", "ok!", "yes 3f2a...", "go ahead please"). Any negation rejects the whole reply.
     */
    public boolean isAffirmative(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return false;
        }
        String normalized = UUID_PATTERN.matcher(text).replaceAll(" ")
                .toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replaceAll("[^\\p{L}\\p{N}' ]+", " ")
                .replaceAll("\\s+", " ")
                .trim();
        if (normalized.isEmpty()) {
            return false;
        }
        List<String> words = List.of(normalized.split(" "));
        if (words.stream().anyMatch(ConfirmationPhrases::isNegation)) {
            return false;
        }
        Optional<String> leading = AFFIRMATIVE_PHRASES.stream()
                .filter(phrase -> normalized.equals(phrase) || normalized.startsWith(phrase + " "))
                .findFirst();
        if (leading.isEmpty()) {
            return false;
        }
        int leadingWords = leading.get().split(" ").length;
        return words.subList(leadingWords, words.size()).stream()
                .allMatch(word -> CONFIRMATION_FILLER_WORDS.contains(word) || AFFIRMATIVE_PHRASES.contains(word));
    }

    private static boolean isNegation(String word) {
        return NEGATION_WORDS.contains(word) || word.endsWith("n't");
    }

    public Optional<UUID> extractTaskId(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        Matcher matcher = UUID_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(matcher.group()));
    }
}
