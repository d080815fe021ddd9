package com.deepansh.mq.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Everything one provider call needs. Immutable so batch workers can share nothing.
 * Null timeout / maxRetries mean "use the configured default".
 */
@Value
@Builder(toBuilder = true)
public class ChatRequest {

    String provider;
    String model;
    List<Message> messages;

    Duration timeout;
    Integer maxRetries;

    Double temperature;
    Double topP;
    Integer topK;

    public static ChatRequestBuilder forModel(ModelConfig config) {
        return ChatRequest.builder()
                .provider(config.getProvider())
                .model(config.getModel())
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .topK(config.getTopK());
    }
}
