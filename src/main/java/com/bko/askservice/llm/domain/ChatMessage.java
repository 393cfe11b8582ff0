package com.bko.askservice.llm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Chat message as it appears on the wire, both in requests and in parsed choices.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(Role role, String content) {

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public enum Role {
        SYSTEM, USER, ASSISTANT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromWireName(String value) {
            if (value == null) {
                return null;
            }
            return Role.valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
