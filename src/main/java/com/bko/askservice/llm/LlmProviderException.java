package com.bko.askservice.llm;

import java.io.IOException;

/**
 * Base type for every failure of a single {@link LlmProvider#ask(String)} call.
 */
public class LlmProviderException extends IOException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
