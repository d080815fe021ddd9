package com.deepansh.mq.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provider call failed.
 *
 * errorInfo carries whatever structured detail is available (provider, model, type,
 * status_code, raw_response_snippet ...). It ends up verbatim in a batch row's
 * {@code error_info} and in the CLI diagnostics line.
 *
 * retryable marks transient failures (429, 5xx, network) so the retry decorator
 * can tell them apart from configuration mistakes like a bad API key.
 */
public class LlmException extends MqException {

    private final Map<String, Object> errorInfo;
    private final boolean retryable;

    public LlmException(String message, Map<String, Object> errorInfo) {
        this(message, errorInfo, false, null);
    }

    public LlmException(String message, Map<String, Object> errorInfo, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorInfo = errorInfo == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(errorInfo));
        this.retryable = retryable;
    }

    public Map<String, Object> getErrorInfo() {
        return errorInfo;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
