package com.taskmentor.completion;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binds structured model replies. Models wrap JSON in prose or markdown fences, so only the first
 * complete JSON object of the reply is parsed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final int SNIPPET_LENGTH = 240;

    private final ObjectMapper objectMapper;

    /**
     * @return the bound value, or {@code null} when the reply holds no parsable object
     */
    public <T> @Nullable T parseJsonResponse(String purpose, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty {} reply, nothing to parse.", purpose);
            return null;
        }
        String candidate = firstObject(unfence(raw));
        if (candidate == null) {
            log.warn("No JSON object in {} reply. Snippet: {}", purpose, snippet(raw));
            return null;
        }
        try {
            return objectMapper.readValue(candidate, type);
        } catch (Exception ex) {
            log.warn("Failed to bind {} reply to {}: {}. Snippet: {}", purpose, type.getSimpleName(),
                    ex.getMessage(), snippet(raw));
            return null;
        }
    }

    private static String unfence(String raw) {
        Matcher fenced = FENCED_BLOCK.matcher(raw);
        return fenced.find() ? fenced.group(1) : raw;
    }

    /**
     * Scans for the first balanced {@code {...}} outside string literals.
     */
    static @Nullable String firstObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return text.substring(start, i + 1);
            }
        }
        return null;
    }

    private static String snippet(String value) {
        String flat = value.replace('\r', ' ').replace('\n', ' ').trim();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
