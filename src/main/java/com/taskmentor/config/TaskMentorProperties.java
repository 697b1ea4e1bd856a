package com.taskmentor.config;

import java.time.Duration;
import java.time.LocalTime;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskmentor")
public class TaskMentorProperties {

    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private CompletionConfig completion = new CompletionConfig();
    private DialogueConfig dialogue = new DialogueConfig();
    private IntentConfig intent = new IntentConfig();
    private ReflectionConfig reflection = new ReflectionConfig();
    private NotificationConfig notifications = new NotificationConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class OpenAIConfig {
        private String model = "gpt-4o-mini";

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class CompletionConfig {
        private Duration timeout = Duration.ofSeconds(30);
        private int concurrency = 4;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class DialogueConfig {
        private int historyLimit = 20;
        private int promptWindow = 6;

        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
        public int getPromptWindow() { return promptWindow; }
        public void setPromptWindow(int promptWindow) { this.promptWindow = promptWindow; }
    }

    public static class IntentConfig {
        private int disambiguationLimit = 10;
        private int suggestionLimit = 5;
        private Duration confirmationWindow = Duration.ofMinutes(10);

        public int getDisambiguationLimit() { return disambiguationLimit; }
        public void setDisambiguationLimit(int disambiguationLimit) { this.disambiguationLimit = disambiguationLimit; }
        public int getSuggestionLimit() { return suggestionLimit; }
        public void setSuggestionLimit(int suggestionLimit) { this.suggestionLimit = suggestionLimit; }
        public Duration getConfirmationWindow() { return confirmationWindow; }
        public void setConfirmationWindow(Duration confirmationWindow) { this.confirmationWindow = confirmationWindow; }
    }

    public static class ReflectionConfig {
        private int summaryHistoryLimit = 30;
        private int gratitudeThemeLength = 100;

        public int getSummaryHistoryLimit() { return summaryHistoryLimit; }
        public void setSummaryHistoryLimit(int summaryHistoryLimit) { this.summaryHistoryLimit = summaryHistoryLimit; }
        public int getGratitudeThemeLength() { return gratitudeThemeLength; }
        public void setGratitudeThemeLength(int gratitudeThemeLength) { this.gratitudeThemeLength = gratitudeThemeLength; }
    }

    public static class NotificationConfig {
        private String digestCron = "0 0 9 * * *";
        private String zone = "UTC";
        private Duration deadlineSweepInterval = Duration.ofHours(2);
        private Duration deadlineHorizon = Duration.ofHours(24);
        private int deadlineListLimit = 5;
        private int digestHighlightLimit = 3;
        private LocalTime defaultSendTime = LocalTime.of(9, 0);

        public String getDigestCron() { return digestCron; }
        public void setDigestCron(String digestCron) { this.digestCron = digestCron; }
        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }
        public Duration getDeadlineSweepInterval() { return deadlineSweepInterval; }
        public void setDeadlineSweepInterval(Duration deadlineSweepInterval) { this.deadlineSweepInterval = deadlineSweepInterval; }
        public Duration getDeadlineHorizon() { return deadlineHorizon; }
        public void setDeadlineHorizon(Duration deadlineHorizon) { this.deadlineHorizon = deadlineHorizon; }
        public int getDeadlineListLimit() { return deadlineListLimit; }
        public void setDeadlineListLimit(int deadlineListLimit) { this.deadlineListLimit = deadlineListLimit; }
        public int getDigestHighlightLimit() { return digestHighlightLimit; }
        public void setDigestHighlightLimit(int digestHighlightLimit) { this.digestHighlightLimit = digestHighlightLimit; }
        public LocalTime getDefaultSendTime() { return defaultSendTime; }
        public void setDefaultSendTime(LocalTime defaultSendTime) { this.defaultSendTime = defaultSendTime; }
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai != null ? openai : new OpenAIConfig();
    }

    public CompletionConfig getCompletion() {
        return completion;
    }

    public void setCompletion(CompletionConfig completion) {
        this.completion = completion != null ? completion : new CompletionConfig();
    }

    public DialogueConfig getDialogue() {
        return dialogue;
    }

    public void setDialogue(DialogueConfig dialogue) {
        this.dialogue = dialogue != null ? dialogue : new DialogueConfig();
    }

    public IntentConfig getIntent() {
        return intent;
    }

    public void setIntent(IntentConfig intent) {
        this.intent = intent != null ? intent : new IntentConfig();
    }

    public ReflectionConfig getReflection() {
        return reflection;
    }

    public void setReflection(ReflectionConfig reflection) {
        this.reflection = reflection != null ? reflection : new ReflectionConfig();
    }

    public NotificationConfig getNotifications() {
        return notifications;
    }

    public void setNotifications(NotificationConfig notifications) {
        this.notifications = notifications != null ? notifications : new NotificationConfig();
    }
}
