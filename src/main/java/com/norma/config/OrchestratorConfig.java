package com.norma.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient googleChatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        return googleGenAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(googleGenAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor(NormaAgentProperties properties) {
        return Executors.newFixedThreadPool(properties.getToolConcurrency());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }
}
