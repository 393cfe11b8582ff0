package com.bko.askservice.llm;

/**
 * The provider answered with a status outside 200-299.
 */
public class ProviderHttpStatusException extends LlmProviderException {
    private final int statusCode;

    public ProviderHttpStatusException(int statusCode) {
        super("Provider API error: HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
