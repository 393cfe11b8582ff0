package com.bko.askservice.llm;

public class ProviderEmptyResponseException extends LlmProviderException {

    public ProviderEmptyResponseException(String message) {
        super(message);
    }
}
