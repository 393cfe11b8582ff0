package com.bko.askservice.llm;

/**
 * Turns a question into an answer, regardless of which backend produces it.
 * Implementations are shared across request threads and must not write state after construction.
 */
public interface LlmProvider {

    /**
     * Sends the question to the model and blocks until the answer arrives.
     * The question is forwarded as-is; callers decide whether blank questions are acceptable.
     */
    AskResult ask(String question) throws LlmProviderException;
}
