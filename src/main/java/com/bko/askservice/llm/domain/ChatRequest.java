package com.bko.askservice.llm.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a chat completion call. Token budget and temperature are fixed so answers stay short and repeatable.
 */
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        @JsonProperty("max_tokens") int maxTokens,
        double temperature
) {
    public static final int MAX_TOKENS = 64;
    public static final double TEMPERATURE = 0.0;

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ChatRequest forQuestion(String model, String question) {
        return new ChatRequest(model, List.of(ChatMessage.user(question)), MAX_TOKENS, TEMPERATURE);
    }
}
