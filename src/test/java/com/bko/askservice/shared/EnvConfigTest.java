package com.bko.askservice.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class EnvConfigTest {

    @Test
    void apiKeyLosesEmbeddedWhitespace() {
        assertEquals("sk-abc123", EnvConfig.normalize("OPENAI_API_KEY", " sk-abc\n123 "));
    }

    @Test
    void baseUrlLosesTrailingSlash() {
        assertEquals("http://localhost:4000/v1", EnvConfig.normalize("OPENAI_BASE_URL", "http://localhost:4000/v1/ "));
    }

    @Test
    void otherKeysAreOnlyTrimmed() {
        assertEquals("gpt 4", EnvConfig.normalize("OPENAI_MODEL", " gpt 4 "));
    }

    @Test
    void blankValuesCountAsMissing() {
        assertNull(EnvConfig.normalize("MOCK_LLM", "   "));
        assertNull(EnvConfig.normalize("MOCK_LLM", null));
    }
}
