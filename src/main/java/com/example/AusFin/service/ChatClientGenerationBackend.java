package com.example.AusFin.service;

import com.example.AusFin.exception.BackendFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link GenerationBackend} over Spring AI {@link ChatClient}s keyed by model name.
 */
public class ChatClientGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationBackend.class);

    private final Map<String, ChatClient> chatClients;
    private final String model;

    public ChatClientGenerationBackend(Map<String, ChatClient> chatClients, String model) {
        this.chatClients = Map.copyOf(chatClients);
        this.model = model;
    }

    @Override
    public String complete(String promptContext, String query) {
        ChatClient chatClient = resolveClient(model);
        String content = chatClient.prompt()
                .user(buildPrompt(promptContext, query))
                .call()
                .content();
        if (content == null || content.isBlank()) {
            throw new BackendFailureException("Generation backend returned an empty completion");
        }
        log.debug("Completion received ({} chars)", content.length());
        return content;
    }

    /**
     * Lookup keys: "<model>ChatClient", then "<model>".
     * Falls back to the deepseek client, then to any available client.
     */
    ChatClient resolveClient(String requested) {
        String key = Optional.ofNullable(requested)
                .map(m -> m.toLowerCase(Locale.ROOT))
                .orElse("deepseek");
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get("deepseek");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }

    private String buildPrompt(String promptContext, String query) {
        StringBuilder sb = new StringBuilder();
        sb.append("Context:\n").append(promptContext).append("\n\n");
        sb.append("Question: ").append(query).append("\n");
        sb.append("Answer concisely from the context. Cite passages as [P:id]. Do not invent figures.");
        return sb.toString();
    }
}
