package com.taskmentor.completion;

import com.taskmentor.config.TaskMentorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class ChatClientCompletionService implements CompletionService {

    static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final TaskMentorProperties properties;
    private final JsonProcessingService jsonProcessingService;
    private final CompletionMetricsService metricsService;
    private final ExecutorService completionExecutor;

    public ChatClientCompletionService(@Qualifier("chatClient") ObjectProvider<ChatClient> chatClientProvider,
                                       @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                       TaskMentorProperties properties,
                                       JsonProcessingService jsonProcessingService,
                                       CompletionMetricsService metricsService,
                                       @Qualifier("completionExecutor") ExecutorService completionExecutor) {
        this.chatClient = chatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.completionExecutor = completionExecutor;
    }

    @Override
    public String complete(String purpose, String systemPrompt, String userTemplate, Map<String, Object> params) {
        metricsService.recordRequest(purpose);
        Duration timeout = properties.getCompletion().getTimeout();
        Future<String> future = completionExecutor.submit(() -> getChatRequestSpec()
                .system(systemPrompt)
                .user(user -> user.text(userTemplate).params(params))
                .call()
                .content());
        String content;
        try {
            content = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            metricsService.recordFailure(purpose, "timeout");
            throw new CompletionFailureException(purpose, "timed out after " + timeout, ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionFailureException(purpose, "interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            metricsService.recordFailure(purpose, cause.getClass().getSimpleName());
            throw new CompletionFailureException(purpose, String.valueOf(cause.getMessage()), cause);
        }
        if (!StringUtils.hasText(content)) {
            metricsService.recordFailure(purpose, "empty");
            throw new CompletionFailureException(purpose, "empty response");
        }
        return content;
    }

    @Override
    public <T> T completeJson(String purpose, String systemPrompt, String userTemplate, Map<String, Object> params,
                              Class<T> type) {
        String response = complete(purpose, systemPrompt, userTemplate, params);
        T parsed = jsonProcessingService.parseJsonResponse(purpose, response, type);
        if (parsed == null) {
            String retryPurpose = purpose + "-retry";
            String retryResponse = complete(retryPurpose, systemPrompt + INVALID_JSON_RETRY_PROMPT, userTemplate, params);
            parsed = jsonProcessingService.parseJsonResponse(retryPurpose, retryResponse, type);
        }
        if (parsed == null) {
            metricsService.recordFailure(purpose, "malformed");
            throw new CompletionFailureException(purpose, "malformed structured reply");
        }
        return parsed;
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAiProvider() == TaskMentorProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        if (chatClient == null) {
            throw new IllegalStateException("Google GenAI provider is not properly configured. "
                    + "Check spring.ai.google.genai settings or switch taskmentor.ai-provider.");
        }
        return chatClient.prompt();
    }
}
