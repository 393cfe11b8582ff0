package com.bko.askservice.llm.openai;

import com.bko.askservice.shared.EnvConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;

@Configuration
public class OpenAiConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(OpenAiConfiguration.class);
    static final String MOCK_API_KEY = "mock-api-key";

    @Bean
    public OpenAiProperties openAiProperties(Environment environment, EnvConfig envConfig) {
        boolean mockMode = Boolean.parseBoolean(firstNonEmpty(
                environment.getProperty("ai.openai.mock"),
                environment.getProperty("MOCK_LLM"),
                envConfig.get("mock_llm")));

        String apiKey = firstNonEmpty(
                environment.getProperty("ai.openai.api-key"),
                environment.getProperty("OPENAI_API_KEY"),
                envConfig.get("openai.api_key"));
        if (apiKey == null && mockMode) {
            logger.info("MOCK_LLM is enabled, using dummy API key");
            apiKey = MOCK_API_KEY;
        } else if (apiKey == null) {
            logger.warn("OPENAI_API_KEY not set and MOCK_LLM not enabled");
        }

        String model = firstNonEmpty(
                environment.getProperty("ai.openai.model"),
                environment.getProperty("OPENAI_MODEL"),
                envConfig.get("openai.model"));
        if (model == null) {
            logger.info("OPENAI_MODEL not set, using default: {}", OpenAiProperties.DEFAULT_MODEL);
        }

        String baseUrl = firstNonEmpty(
                environment.getProperty("ai.openai.base-url"),
                environment.getProperty("OPENAI_BASE_URL"),
                envConfig.get("openai.base_url"));

        String timeoutValue = firstNonEmpty(environment.getProperty("ai.openai.timeout"));
        Duration timeout = timeoutValue != null ? DurationStyle.detectAndParse(timeoutValue) : null;

        OpenAiProperties properties = new OpenAiProperties(apiKey, model, mockMode, baseUrl, timeout);
        logger.info("Configuration: model={}, mockMode={}", properties.model(), properties.mockMode());
        return properties;
    }

    private String firstNonEmpty(String... values) {
        if (values == null) return null;
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
