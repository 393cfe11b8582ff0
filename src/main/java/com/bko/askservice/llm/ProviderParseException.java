package com.bko.askservice.llm;

public class ProviderParseException extends LlmProviderException {

    public ProviderParseException(String message) {
        super(message);
    }

    public ProviderParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
