package com.bko.askservice.llm;

public class ProviderSchemaException extends LlmProviderException {

    public ProviderSchemaException(String message) {
        super(message);
    }

    public ProviderSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
