package com.deepansh.mq.llm;

import com.deepansh.mq.config.MqProperties;
import com.deepansh.mq.exception.LlmException;
import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Decorator around the HTTP client that adds bounded retries.
 *
 * maxRetries comes from the request (falling back to mq.request.max-retries), so the
 * Retry is built per call rather than shared. Only failures the delegate marks
 * retryable (429, 5xx, network) are retried; a bad key or bad model fails at once.
 * Backoff is exponential starting at mq.request.retry-backoff.
 *
 * When attempts run out the last LlmException propagates unchanged.
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private static final Duration MIN_BACKOFF = Duration.ofMillis(1);

    private final LlmClient delegate;
    private final MqProperties properties;

    public ResilientLlmClient(LlmClient delegate, MqProperties properties) {
        this.delegate = delegate;
        this.properties = properties;
    }

    @Override
    public ChatResult chat(ChatRequest request) {
        ChatRequest resolved = withDefaults(request);
        int maxRetries = resolved.getMaxRetries();
        if (maxRetries <= 0) {
            return delegate.chat(resolved);
        }

        Duration backoff = properties.getRequest().getRetryBackoff();
        if (backoff == null || backoff.compareTo(MIN_BACKOFF) < 0) backoff = MIN_BACKOFF;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
                .retryOnException(e -> e instanceof LlmException llm && llm.isRetryable())
                .build();
        Retry retry = Retry.of("llm-" + resolved.getProvider(), config);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "{} call failed (attempt {}/{}), retrying in {}ms: {}",
                resolved.getProvider(), event.getNumberOfRetryAttempts(), maxRetries + 1,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));

        return retry.executeSupplier(() -> delegate.chat(resolved));
    }

    private ChatRequest withDefaults(ChatRequest request) {
        MqProperties.Request defaults = properties.getRequest();
        return request.toBuilder()
                .timeout(request.getTimeout() != null ? request.getTimeout() : defaults.getTimeout())
                .maxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : defaults.getMaxRetries())
                .build();
    }
}
