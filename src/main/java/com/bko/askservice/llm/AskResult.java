package com.bko.askservice.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Answer text plus the provider payload it was extracted from.
 * The raw payload is the tree parsed from the provider body, so fields this client does not model survive.
 */
public record AskResult(String answer, JsonNode rawPayload) {
    public AskResult {
        Objects.requireNonNull(answer, "answer");
    }

    public Optional<JsonNode> raw() {
        return Optional.ofNullable(rawPayload);
    }
}
