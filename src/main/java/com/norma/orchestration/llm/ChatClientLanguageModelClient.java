package com.norma.orchestration.llm;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@Slf4j
public class ChatClientLanguageModelClient implements LanguageModelClient {

    private final ChatClient googleChatClient;
    private final ChatClient openAiChatClient;
    private final NormaAgentProperties properties;

    public ChatClientLanguageModelClient(@Qualifier("googleChatClient") ObjectProvider<ChatClient> googleChatClientProvider,
                                         @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                         NormaAgentProperties properties) {
        this.googleChatClient = googleChatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    public String call(LlmRequest request) {
        ChatClient.ChatClientRequestSpec spec = getChatRequestSpec().system(request.systemPrompt());
        if (request.params().isEmpty()) {
            spec = spec.user(request.userTemplate());
        } else {
            spec = spec.user(user -> user.text(request.userTemplate()).params(request.params()));
        }
        try {
            String content = spec.call().content();
            return content == null ? "" : content;
        } catch (RuntimeException ex) {
            log.warn("Language model call failed (purpose={}): {}", request.purpose(), ex.getMessage());
            throw new ServiceUnavailableException("Language model provider "
                    + properties.getAiProvider() + " is unavailable", ex);
        }
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAiProvider() == NormaAgentProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new ServiceUnavailableException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.", null);
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        if (googleChatClient == null) {
            throw new ServiceUnavailableException("Google GenAI provider is not properly configured. "
                    + "Check spring.ai.google.genai settings.", null);
        }
        return googleChatClient.prompt();
    }
}
