package com.bko.askservice.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this.dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
    }

    public String get(String key) {
        String envKey = key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        return normalize(envKey, value);
    }

    static String normalize(String envKey, String value) {
        if (value == null) {
            return null;
        }
        value = value.trim();
        // Keys pasted from the dashboard often carry line breaks.
        if (envKey.equals("OPENAI_API_KEY")) {
            value = value.replaceAll("\\s", "");
        }
        if (envKey.equals("OPENAI_BASE_URL") && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }
}
