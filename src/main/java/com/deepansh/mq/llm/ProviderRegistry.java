package com.deepansh.mq.llm;

import com.deepansh.mq.config.MqProperties;
import com.deepansh.mq.exception.UserException;

import java.util.Set;

/**
 * Known providers, from {@code mq.providers} in application.yml.
 */
public class ProviderRegistry {

    private final MqProperties properties;

    public ProviderRegistry(MqProperties properties) {
        this.properties = properties;
    }

    /** @throws UserException when the provider is not configured */
    public MqProperties.Provider require(String name) {
        MqProperties.Provider provider = name == null ? null : properties.getProviders().get(name);
        if (provider == null || provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
            throw new UserException("Unknown provider: '" + name + "' (configured: "
                    + String.join(", ", names()) + ")");
        }
        return provider;
    }

    public Set<String> names() {
        return properties.getProviders().keySet();
    }
}
