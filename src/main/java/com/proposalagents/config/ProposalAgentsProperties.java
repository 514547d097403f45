package com.proposalagents.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "proposal")
public class ProposalAgentsProperties {

    private Duration taskTimeout = Duration.ofSeconds(300);
    private Duration synthesisTimeout;
    private Duration jobDeadline;
    private int workerConcurrency = 6;
    private int maxTopicLength = 2000;
    private boolean httpLogging = false;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private ReportsConfig reports = new ReportsConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class OpenAIConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class ReportsConfig {
        private String directory = "reports";
        private String extension = ".md";
        private int titleWords = 4;
        private int maxTitleLength = 60;
        private String fallbackPrefix = "Fallback_Report";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public String getExtension() { return extension; }
        public void setExtension(String extension) { this.extension = extension; }
        public int getTitleWords() { return titleWords; }
        public void setTitleWords(int titleWords) { this.titleWords = titleWords; }
        public int getMaxTitleLength() { return maxTitleLength; }
        public void setMaxTitleLength(int maxTitleLength) { this.maxTitleLength = maxTitleLength; }
        public String getFallbackPrefix() { return fallbackPrefix; }
        public void setFallbackPrefix(String fallbackPrefix) { this.fallbackPrefix = fallbackPrefix; }
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
            return;
        }
        this.taskTimeout = taskTimeout;
    }

    public Duration getSynthesisTimeout() {
        return synthesisTimeout != null ? synthesisTimeout : taskTimeout;
    }

    public void setSynthesisTimeout(Duration synthesisTimeout) {
        this.synthesisTimeout = synthesisTimeout;
    }

    public Duration getJobDeadline() {
        return jobDeadline;
    }

    public void setJobDeadline(Duration jobDeadline) {
        this.jobDeadline = jobDeadline;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public int getMaxTopicLength() {
        return maxTopicLength;
    }

    public void setMaxTopicLength(int maxTopicLength) {
        this.maxTopicLength = maxTopicLength;
    }

    public boolean isHttpLogging() {
        return httpLogging;
    }

    public void setHttpLogging(boolean httpLogging) {
        this.httpLogging = httpLogging;
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

    public ReportsConfig getReports() {
        return reports;
    }

    public void setReports(ReportsConfig reports) {
        this.reports = reports != null ? reports : new ReportsConfig();
    }
}
