package com.norma.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "norma")
public class NormaAgentProperties {

    private int maxSteps = 12;
    private int maxReplans = 5;
    private int loopWindow = 3;
    private double relevanceThreshold = 0.5;
    private int parseRetries = 3;
    private int toolRetries = 1;
    private Duration toolTimeout = Duration.ofSeconds(60);
    private int toolConcurrency = 4;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private GoogleConfig google = new GoogleConfig();
    private SearchConfig search = new SearchConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class GoogleConfig {
        private String apiKey;
        private String model = "gemini-2.5-flash";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class OpenAIConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o-mini";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class SearchConfig {
        private String baseUrl = "http://localhost:8080";
        private String schema = "norm_page";
        private int hits = 5;
        private Duration timeout = Duration.ofSeconds(10);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getSchema() { return schema; }
        public void setSchema(String schema) { this.schema = schema; }
        public int getHits() { return hits; }
        public void setHits(int hits) { this.hits = hits; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int getMaxReplans() {
        return maxReplans;
    }

    public void setMaxReplans(int maxReplans) {
        this.maxReplans = maxReplans;
    }

    public int getLoopWindow() {
        return loopWindow;
    }

    public void setLoopWindow(int loopWindow) {
        this.loopWindow = Math.max(2, loopWindow);
    }

    public double getRelevanceThreshold() {
        return relevanceThreshold;
    }

    public void setRelevanceThreshold(double relevanceThreshold) {
        this.relevanceThreshold = relevanceThreshold;
    }

    public int getParseRetries() {
        return parseRetries;
    }

    public void setParseRetries(int parseRetries) {
        this.parseRetries = Math.max(1, parseRetries);
    }

    public int getToolRetries() {
        return toolRetries;
    }

    public void setToolRetries(int toolRetries) {
        this.toolRetries = Math.max(0, toolRetries);
    }

    public Duration getToolTimeout() {
        return toolTimeout;
    }

    public void setToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
    }

    public int getToolConcurrency() {
        return toolConcurrency;
    }

    public void setToolConcurrency(int toolConcurrency) {
        this.toolConcurrency = toolConcurrency;
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
        this.openai = openai;
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search;
    }
}
