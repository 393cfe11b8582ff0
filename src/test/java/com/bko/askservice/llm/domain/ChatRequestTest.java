package com.bko.askservice.llm.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChatRequestTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void forQuestionBuildsSingleUserMessageWithFixedSampling() {
        ChatRequest request = ChatRequest.forQuestion("gpt-4o-mini", "Why is the sky blue?");

        assertEquals(1, request.messages().size());
        assertEquals(ChatMessage.Role.USER, request.messages().get(0).role());
        assertEquals("Why is the sky blue?", request.messages().get(0).content());
        assertEquals(64, request.maxTokens());
        assertEquals(0.0, request.temperature());
    }

    @Test
    void serializesWithWireFieldNames() throws Exception {
        JsonNode json = objectMapper.valueToTree(ChatRequest.forQuestion("gpt-4o-mini", "hi"));

        assertEquals("gpt-4o-mini", json.get("model").asText());
        assertEquals("user", json.get("messages").get(0).get("role").asText());
        assertEquals(64, json.get("max_tokens").asInt());
        assertEquals(0.0, json.get("temperature").asDouble());
    }

    @Test
    void messagesAreImmutable() {
        ChatRequest request = ChatRequest.forQuestion("gpt-4o-mini", "hi");

        assertThrows(UnsupportedOperationException.class, () -> request.messages().add(ChatMessage.user("more")));
    }

    @Test
    void responseParsesLowercaseRolesAndIgnoresUnknownFields() throws Exception {
        ChatResponse response = objectMapper.readValue(
                "{\"id\":\"x\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"ok\",\"refusal\":null}}]}",
                ChatResponse.class);

        assertEquals(ChatMessage.Role.ASSISTANT, response.choices().get(0).message().role());
        assertEquals("ok", response.choices().get(0).message().content());
    }
}
