package com.deepansh.mq.model;

/**
 * Successful provider answer. reasoning is null when the provider returned no trace.
 */
public record ChatResult(String content, String reasoning) {

    public ChatResult(String content) {
        this(content, null);
    }

    public boolean hasReasoning() {
        return reasoning != null && !reasoning.isBlank();
    }
}
