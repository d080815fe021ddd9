package com.deepansh.mq.llm;

import com.deepansh.mq.config.HttpClientConfig.RestClientFactory;
import com.deepansh.mq.config.MqProperties;
import com.deepansh.mq.exception.LlmException;
import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;
import com.deepansh.mq.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpenAI-compatible chat-completions client for every configured provider
 * (OpenAI, Groq, Gemini's OpenAI endpoint, OpenRouter, Ollama ...).
 *
 * Error handling strategy:
 *
 * | Error               | Action                                          |
 * |---------------------|-------------------------------------------------|
 * | API key not set     | LlmException type=auth_error, not retryable     |
 * | 401 / 403           | LlmException type from body, not retryable      |
 * | 429                 | LlmException, retryable                         |
 * | other 4xx           | LlmException, not retryable                     |
 * | 5xx                 | LlmException, retryable                         |
 * | network / timeout   | LlmException type=network_error, retryable      |
 * | no content in reply | LlmException, not retryable                     |
 *
 * Retrying is not done here; see {@link ResilientLlmClient}.
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final ProviderRegistry providers;
    private final MqProperties properties;
    private final ObjectMapper objectMapper;
    private final RestClientFactory restClientFactory;

    private final Map<String, RestClient> clients = new ConcurrentHashMap<>();

    public GenericLlmClient(ProviderRegistry providers,
                            MqProperties properties,
                            ObjectMapper objectMapper,
                            RestClientFactory restClientFactory) {
        this.providers = providers;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClientFactory = restClientFactory;
    }

    @Override
    public ChatResult chat(ChatRequest request) {
        String providerName = request.getProvider();
        MqProperties.Provider provider = providers.require(providerName);
        Duration timeout = request.getTimeout() != null
                ? request.getTimeout()
                : properties.getRequest().getTimeout();

        String apiKey = provider.resolveApiKey();
        if (apiKey == null && provider.getApiKeyEnv() != null && !provider.getApiKeyEnv().isBlank()) {
            Map<String, Object> info = baseInfo(request);
            info.put("type", "auth_error");
            throw new LlmException(providerName + " API key not set. Set env var: " + provider.getApiKeyEnv(), info);
        }

        log.debug("Sending {} messages to {} [model={}, timeout={}s]",
                request.getMessages().size(), providerName, request.getModel(), timeout.toSeconds());

        Map<String, Object> response;
        try {
            response = clientFor(providerName, provider, apiKey, timeout).post()
                    .uri("/chat/completions")
                    .body(buildRequestBody(request))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.debug("{} error [{}]: {}", providerName, status, body);
                        throw httpError(request, status, body);
                    })
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});
        } catch (ResourceAccessException e) {
            Map<String, Object> info = baseInfo(request);
            info.put("type", "network_error");
            throw new LlmException(providerName + " request failed: " + e.getMessage(), info, true, e);
        } catch (RestClientException e) {
            Map<String, Object> info = baseInfo(request);
            info.put("type", "client_error");
            throw new LlmException(providerName + " request failed: " + e.getMessage(), info, false, e);
        }

        String content = ResponseParser.content(response);
        if (content == null) {
            Map<String, Object> info = baseInfo(request);
            info.put("raw_provider_response_snippet", ResponseParser.jsonSnippet(objectMapper, response));
            throw new LlmException("LLM response missing content", info);
        }
        return new ChatResult(content, ResponseParser.reasoning(response));
    }

    /**
     * Maps an HTTP error status and body to an LlmException. Message comes from the
     * provider's {@code error.message} when the body is JSON.
     */
    LlmException httpError(ChatRequest request, int status, String body) {
        Map<String, Object> info = baseInfo(request);
        info.put("status_code", status);

        String message = null;
        String type = null;
        Map<String, Object> parsed = parseErrorBody(body);
        if (parsed != null && parsed.get("error") instanceof Map<?, ?> error) {
            if (error.get("message") instanceof String m && !m.isBlank()) message = m.strip();
            if (error.get("type") instanceof String t && !t.isBlank()) type = t;
            else if (error.get("code") instanceof String c && !c.isBlank()) type = c;
        } else if (parsed != null && parsed.get("message") instanceof String m && !m.isBlank()) {
            message = m.strip();
        }
        info.put("type", type != null ? type : (status >= 500 ? "server_error" : "api_error"));
        if (body != null && !body.isBlank()) {
            info.put("raw_response_snippet", ResponseParser.truncate(body));
        }

        String text = "Error (HTTP " + status + ")" + (message != null ? ": " + message : "");
        boolean retryable = status == 429 || status >= 500;
        return new LlmException(text, info, retryable, null);
    }

    private Map<String, Object> parseErrorBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private RestClient clientFor(String name, MqProperties.Provider provider, String apiKey, Duration timeout) {
        return clients.computeIfAbsent(name + "@" + timeout.toMillis(), key -> {
            RestClient.Builder builder = restClientFactory.builder(timeout)
                    .baseUrl(provider.getBaseUrl())
                    .defaultHeader("Content-Type", "application/json");
            if (apiKey != null) {
                builder.defaultHeader("Authorization", "Bearer " + apiKey);
            }
            return builder.build();
        });
    }

    private Map<String, Object> buildRequestBody(ChatRequest request) {
        List<Map<String, Object>> formattedMessages = request.getMessages().stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel());
        body.put("messages", formattedMessages);
        if (request.getTemperature() != null) body.put("temperature", request.getTemperature());
        if (request.getTopP() != null) body.put("top_p", request.getTopP());
        if (request.getTopK() != null) body.put("top_k", request.getTopK());
        if (properties.getRequest().getMaxTokens() > 0) {
            body.put("max_tokens", properties.getRequest().getMaxTokens());
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    private Map<String, Object> baseInfo(ChatRequest request) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", request.getProvider());
        info.put("model", request.getModel());
        return info;
    }
}
