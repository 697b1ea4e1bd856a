package com.taskmentor.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CompletionConfig {

    @Bean
    @Primary
    public ChatClient chatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        GoogleGenAiChatModel model = googleGenAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService completionExecutor(TaskMentorProperties properties) {
        return Executors.newFixedThreadPool(properties.getCompletion().getConcurrency());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
