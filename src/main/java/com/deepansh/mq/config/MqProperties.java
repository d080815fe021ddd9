package com.deepansh.mq.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed configuration for mq.
 * Bound from application.yml under the "mq" prefix.
 */
@ConfigurationProperties(prefix = "mq")
@Data
public class MqProperties {

    /** State directory holding config.json, sessions/ and last_conversation.json. */
    private String home = Paths.get(System.getProperty("user.home"), ".mq").toString();

    private Request request = new Request();
    private Batch batch = new Batch();

    /** Provider name (as used by `mq add --provider`) to endpoint. */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public Path homePath() {
        String value = home;
        if (value.startsWith("~")) {
            value = System.getProperty("user.home") + value.substring(1);
        }
        return Paths.get(value).toAbsolutePath();
    }

    @Data
    public static class Request {
        private Duration timeout = Duration.ofSeconds(600);
        private Duration connectTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        /** First wait between attempts; doubles on each further attempt. */
        private Duration retryBackoff = Duration.ofSeconds(2);
        private int maxTokens = 0;
    }

    @Data
    public static class Batch {
        private int workers = 4;
    }

    @Data
    public static class Provider {
        /** OpenAI-compatible base URL, e.g. https://api.openai.com/v1 */
        private String baseUrl;
        /** Environment variable holding the API key. */
        private String apiKeyEnv;
        /** Literal key; wins over apiKeyEnv when set. */
        private String apiKey;

        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) return apiKey;
            if (apiKeyEnv == null || apiKeyEnv.isBlank()) return null;
            String fromEnv = System.getenv(apiKeyEnv);
            return fromEnv == null || fromEnv.isBlank() ? null : fromEnv;
        }
    }
}
