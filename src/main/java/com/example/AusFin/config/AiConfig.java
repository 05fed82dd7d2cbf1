package com.example.AusFin.config;

import com.example.AusFin.service.ChatClientGenerationBackend;
import com.example.AusFin.service.GenerationBackend;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class AiConfig {

    /**
     * One ChatClient per available chat model, keyed "deepseek" / "openai".
     * Models are looked up lazily so a missing API key in some environments only removes that client.
     */
    @Bean
    public GenerationBackend generationBackend(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            AdvisorProperties properties
    ) {
        String systemPrompt = properties.getGeneration().getSystemPrompt();
        Map<String, ChatClient> clients = new LinkedHashMap<>();

        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            clients.put("deepseek", ChatClient.builder(deepseekModel)
                    .defaultSystem(systemPrompt)
                    .build());
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            clients.put("openai", ChatClient.builder(openAiModel)
                    .defaultSystem(systemPrompt)
                    .build());
        }

        if (clients.isEmpty()) {
            throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
        }
        return new ChatClientGenerationBackend(clients, properties.getGeneration().getModel());
    }
}
