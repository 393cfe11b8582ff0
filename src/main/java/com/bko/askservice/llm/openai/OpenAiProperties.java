package com.bko.askservice.llm.openai;

import java.time.Duration;

/**
 * Provider settings resolved once at startup. Blank values fall back to the defaults below.
 */
public record OpenAiProperties(
        String apiKey,
        String model,
        boolean mockMode,
        String baseUrl,
        Duration timeout
) {
    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    public OpenAiProperties {
        model = hasText(model) ? model : DEFAULT_MODEL;
        baseUrl = hasText(baseUrl) ? stripTrailingSlash(baseUrl) : DEFAULT_BASE_URL;
        timeout = (timeout == null || timeout.isZero() || timeout.isNegative()) ? DEFAULT_TIMEOUT : timeout;
    }

    public boolean hasApiKey() {
        return hasText(apiKey);
    }

    @Override
    public String toString() {
        // Keeps the key out of logs.
        return "OpenAiProperties[model=" + model + ", mockMode=" + mockMode
                + ", baseUrl=" + baseUrl + ", timeout=" + timeout + "]";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
