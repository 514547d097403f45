package com.proposalagents.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntFunction;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient googleChatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        GoogleGenAiChatModel model = googleGenAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    /**
     * Each fan-out gets its own pool so concurrent jobs never queue behind each other.
     * The coordinator shuts the pool down when its batch is done.
     */
    @Bean
    public IntFunction<ExecutorService> fanOutExecutorFactory() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("specialist-");
        return poolSize -> Executors.newFixedThreadPool(poolSize, threadFactory);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
