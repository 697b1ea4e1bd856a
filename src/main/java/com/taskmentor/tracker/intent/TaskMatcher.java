package com.taskmentor.tracker.intent;

import com.taskmentor.entity.Task;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tiered lookup of tasks by a free-text phrase. Tiers are tried in order and the first one that
 * yields any match wins:
 * <ol>
 *     <li>case-insensitive substring of title and description (1.0 on the title, 0.9 otherwise)</li>
 *     <li>every word of a multi-word phrase present (0.75)</li>
 *     <li>the same after naive suffix folding on both sides (0.6)</li>
 * </ol>
 */
@Component
public class TaskMatcher {

    static final double TITLE_CONFIDENCE = 1.0;
    static final double DESCRIPTION_CONFIDENCE = 0.9;
    static final double ALL_WORDS_CONFIDENCE = 0.75;
    static final double FOLDED_CONFIDENCE = 0.6;

    public List<TaskMatch> match(String phrase, List<Task> tasks) {
        if (!StringUtils.hasText(phrase) || tasks.isEmpty()) {
            return List.of();
        }
        String needle = normalize(phrase);
        List<String> words = words(needle);
        if (words.isEmpty()) {
            return List.of();
        }

        List<TaskMatch> matches = substringMatches(needle, tasks);
        if (matches.isEmpty() && words.size() > 1) {
            matches = allWordsMatches(words, tasks);
        }
        if (matches.isEmpty()) {
            matches = foldedMatches(words, tasks);
        }
        matches.sort(Comparator.comparingDouble(TaskMatch::confidence).reversed()
                .thenComparing(match -> match.task().getTitle()));
        return matches;
    }

    private List<TaskMatch> substringMatches(String needle, List<Task> tasks) {
        List<TaskMatch> matches = new ArrayList<>();
        for (Task task : tasks) {
            if (normalize(task.getTitle()).contains(needle)) {
                matches.add(new TaskMatch(task, TITLE_CONFIDENCE, MatchTier.SUBSTRING));
            } else if (normalize(task.getDescription()).contains(needle)) {
                matches.add(new TaskMatch(task, DESCRIPTION_CONFIDENCE, MatchTier.SUBSTRING));
            }
        }
        return matches;
    }

    private List<TaskMatch> allWordsMatches(List<String> words, List<Task> tasks) {
        List<TaskMatch> matches = new ArrayList<>();
        for (Task task : tasks) {
            String haystack = haystack(task);
            if (words.stream().allMatch(haystack::contains)) {
                matches.add(new TaskMatch(task, ALL_WORDS_CONFIDENCE, MatchTier.ALL_WORDS));
            }
        }
        return matches;
    }

    private List<TaskMatch> foldedMatches(List<String> words, List<Task> tasks) {
        Set<String> foldedPhrase = words.stream().map(TaskMatcher::fold).collect(Collectors.toSet());
        List<TaskMatch> matches = new ArrayList<>();
        for (Task task : tasks) {
            Set<String> foldedTask = words(haystack(task)).stream()
                    .map(TaskMatcher::fold)
                    .collect(Collectors.toSet());
            if (foldedTask.containsAll(foldedPhrase)) {
                matches.add(new TaskMatch(task, FOLDED_CONFIDENCE, MatchTier.FOLDED));
            }
        }
        return matches;
    }

    private String haystack(Task task) {
        return normalize(task.getTitle()) + " " + normalize(task.getDescription());
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    private static List<String> words(String value) {
        return Arrays.stream(value.split("[^\\p{L}\\p{N}]+"))
                .filter(StringUtils::hasText)
                .toList();
    }

    /**
     * Strips common English inflections: reports/report, reading/read, cleaned/clean, stories/story.
     */
    static String fold(String word) {
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 5 && word.endsWith("ing")) {
            return word.substring(0, word.length() - 3);
        }
        if (word.length() > 4 && word.endsWith("ed")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 4 && (word.endsWith("ches") || word.endsWith("shes") || word.endsWith("xes"))) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
