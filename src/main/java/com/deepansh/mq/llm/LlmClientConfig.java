package com.deepansh.mq.llm;

import com.deepansh.mq.config.HttpClientConfig.RestClientFactory;
import com.deepansh.mq.config.MqProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the request function: HTTP client for every configured provider, wrapped by
 * the retry decorator. Everything else depends on the {@link Primary} bean.
 */
@Configuration
public class LlmClientConfig {

    @Bean
    public ProviderRegistry providerRegistry(MqProperties properties) {
        return new ProviderRegistry(properties);
    }

    @Bean("httpLlmClient")
    public LlmClient httpLlmClient(ProviderRegistry providers,
                                   MqProperties properties,
                                   ObjectMapper objectMapper,
                                   RestClientFactory restClientFactory) {
        return new GenericLlmClient(providers, properties, objectMapper, restClientFactory);
    }

    @Bean
    @Primary
    public LlmClient llmClient(@Qualifier("httpLlmClient") LlmClient delegate, MqProperties properties) {
        return new ResilientLlmClient(delegate, properties);
    }
}
