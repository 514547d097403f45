package com.proposalagents.orchestration.service;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.exception.MalformedGenerationResponseException;
import com.proposalagents.orchestration.api.GenerationCapability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * {@link GenerationCapability} backed by a Spring AI {@link ChatClient}. The provider is
 * chosen from {@code proposal.ai-provider}; every call builds a fresh prompt request.
 */
@Service
@Slf4j
public class ChatClientGenerationCapability implements GenerationCapability {

    private final ChatClient googleChatClient;
    private final ChatClient openAiChatClient;
    private final ProposalAgentsProperties properties;

    public ChatClientGenerationCapability(@Qualifier("googleChatClient") ObjectProvider<ChatClient> googleChatClientProvider,
                                          @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                          ProposalAgentsProperties properties) {
        this.googleChatClient = googleChatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    @Nullable
    public String generate(String instruction, Duration timeout) {
        ChatResponse response = getChatRequestSpec()
                .user(instruction)
                .call()
                .chatResponse();
        if (response == null) {
            return null;
        }
        Generation result = response.getResult();
        if (result == null || result.getOutput() == null) {
            return null;
        }
        AssistantMessage output = result.getOutput();
        if (!StringUtils.hasText(output.getText()) && output.hasToolCalls()) {
            throw new MalformedGenerationResponseException(
                    "Provider returned tool calls instead of text (" + output.getToolCalls().size() + " call(s)).");
        }
        return output.getText();
    }

    @Override
    public String describe() {
        ProposalAgentsProperties.AiProvider provider = properties.getAiProvider();
        String model = properties.getOpenai().getModel();
        if (provider == ProposalAgentsProperties.AiProvider.OPENAI && StringUtils.hasText(model)) {
            return provider.name() + "/" + model;
        }
        return provider.name();
    }

    @Override
    public boolean isAvailable() {
        return activeClient() != null;
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        ChatClient client = activeClient();
        if (client == null) {
            throw new IllegalStateException(properties.getAiProvider() + " provider is not properly configured. "
                    + "Check that you have a valid API key or a custom Base URL in your configuration.");
        }
        var spec = client.prompt();
        String model = properties.getOpenai().getModel();
        if (properties.getAiProvider() == ProposalAgentsProperties.AiProvider.OPENAI && StringUtils.hasText(model)) {
            spec = spec.options(OpenAiChatOptions.builder().model(model).build());
        }
        return spec;
    }

    @Nullable
    private ChatClient activeClient() {
        return properties.getAiProvider() == ProposalAgentsProperties.AiProvider.OPENAI
                ? openAiChatClient
                : googleChatClient;
    }
}
