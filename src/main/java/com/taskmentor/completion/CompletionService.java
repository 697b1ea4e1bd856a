package com.taskmentor.completion;

import java.util.Map;

/**
 * Language-model completion boundary. Implementations may block, fail or time out; every
 * failure surfaces as {@link CompletionFailureException}.
 */
public interface CompletionService {

    /**
     * Returns free text for the given prompt.
     *
     * @param purpose      short label used for logging and metrics
     * @param systemPrompt system instructions, sent verbatim
     * @param userTemplate user message template with {@code {placeholder}} parameters
     * @param params       values for the template placeholders
     */
    String complete(String purpose, String systemPrompt, String userTemplate, Map<String, Object> params);

    /**
     * Requests a structured JSON reply and binds it to {@code type}. A malformed reply is retried
     * once before failing.
     */
    <T> T completeJson(String purpose, String systemPrompt, String userTemplate, Map<String, Object> params,
                       Class<T> type);
}
