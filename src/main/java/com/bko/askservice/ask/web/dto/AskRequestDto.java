package com.bko.askservice.ask.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AskRequestDto(
        @JsonProperty(value = "question", required = true) String question
) {
    public AskRequestDto {
        if (question == null) {
            throw new IllegalArgumentException("question must not be null");
        }
    }
}
