package com.deepansh.mq.llm;

import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;

/**
 * One blocking chat-completion call. Safe to call from many threads at once with
 * distinct requests.
 */
public interface LlmClient {

    /**
     * Send the conversation to the request's provider/model.
     *
     * @return the answer text and, when the provider exposes one, its reasoning trace
     * @throws com.deepansh.mq.exception.LlmException when the provider call fails
     */
    ChatResult chat(ChatRequest request);
}
