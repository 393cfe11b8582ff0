package com.bko.askservice.llm.openai;

import com.bko.askservice.llm.AskResult;
import com.bko.askservice.llm.LlmProvider;
import com.bko.askservice.llm.LlmProviderException;
import com.bko.askservice.llm.ProviderEmptyResponseException;
import com.bko.askservice.llm.ProviderHttpStatusException;
import com.bko.askservice.llm.ProviderNetworkException;
import com.bko.askservice.llm.ProviderParseException;
import com.bko.askservice.llm.ProviderSchemaException;
import com.bko.askservice.llm.domain.ChatMessage;
import com.bko.askservice.llm.domain.ChatRequest;
import com.bko.askservice.llm.domain.ChatResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Chat completion client for the OpenAI API. In mock mode no request leaves the process and every call
 * returns the same canned completion.
 */
@Component
public class OpenAiClient implements LlmProvider {
    private static final Logger logger = LoggerFactory.getLogger(OpenAiClient.class);

    static final String MOCK_ANSWER = "This is a mock response for testing purposes.";
    static final String MOCK_ID = "mock-123";

    private final OpenAiProperties properties;
    private final URI completionsUri;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final HttpClient httpClient;

    public OpenAiClient(OpenAiProperties properties) {
        if (!properties.mockMode() && !properties.hasApiKey()) {
            throw new IllegalStateException("OpenAI API key missing; set OPENAI_API_KEY or enable MOCK_LLM.");
        }
        this.properties = properties;
        this.completionsUri = URI.create(properties.baseUrl() + "/chat/completions");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.timeout())
                .build();
    }

    @Override
    public AskResult ask(String question) throws LlmProviderException {
        if (properties.mockMode()) {
            return new AskResult(MOCK_ANSWER, mockPayload());
        }

        ChatRequest payload = ChatRequest.forQuestion(properties.model(), question);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(completionsUri)
                .timeout(properties.timeout())
                .header("Authorization", "Bearer " + properties.apiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                .build();

        HttpResponse<String> response = send(request);
        String body = response.body();
        if (response.statusCode() < 200 || response.statusCode() > 299) {
            logger.error("OpenAI API error: HTTP {} - {}", response.statusCode(), body);
            throw new ProviderHttpStatusException(response.statusCode());
        }

        JsonNode raw = parse(body);
        ChatResponse parsed = toChatResponse(raw);
        if (parsed.choices().isEmpty()) {
            throw new ProviderEmptyResponseException("OpenAI returned no choices");
        }
        ChatResponse.Choice first = parsed.choices().get(0);
        if (first == null || first.message() == null || first.message().content() == null) {
            throw new ProviderSchemaException("OpenAI choice has no message content");
        }
        return new AskResult(first.message().content(), raw);
    }

    private HttpResponse<String> send(HttpRequest request) throws ProviderNetworkException {
        Duration timeout = properties.timeout();
        CompletableFuture<HttpResponse<String>> pending =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new ProviderNetworkException("OpenAI request timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderNetworkException("Interrupted while calling OpenAI API", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProviderNetworkException("OpenAI request failed: " + cause, cause);
        }
    }

    private JsonNode parse(String body) throws ProviderParseException {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderParseException("OpenAI response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ProviderParseException("OpenAI response body is empty");
        }
        return node;
    }

    private ChatResponse toChatResponse(JsonNode raw) throws ProviderSchemaException {
        ChatResponse parsed;
        try {
            parsed = objectMapper.treeToValue(raw, ChatResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProviderSchemaException("OpenAI response does not match the chat completion shape", e);
        }
        if (parsed == null || parsed.choices() == null) {
            throw new ProviderSchemaException("OpenAI response has no choices field");
        }
        return parsed;
    }

    private String toJson(ChatRequest payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat request", e);
        }
    }

    // Same shape as a live completion so callers cannot tell the two apart structurally.
    private JsonNode mockPayload() {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", MOCK_ID);
        root.put("object", "chat.completion");
        root.put("model", properties.model());
        ObjectNode choice = root.putArray("choices").addObject();
        choice.put("index", 0);
        choice.set("message", objectMapper.valueToTree(new ChatMessage(ChatMessage.Role.ASSISTANT, MOCK_ANSWER)));
        choice.put("finish_reason", "stop");
        return root;
    }
}
