package com.bko.askservice.llm;

public class ProviderNetworkException extends LlmProviderException {

    public ProviderNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
