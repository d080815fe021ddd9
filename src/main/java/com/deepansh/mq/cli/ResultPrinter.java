package com.deepansh.mq.cli;

import com.deepansh.mq.exception.MqException;
import com.deepansh.mq.model.ChatResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Formats a model answer for stdout.
 *
 * Plain mode: optional {@code session: <id>} header, then the reasoning block
 * (when there is one) followed by a {@code response:} header, then the content.
 * JSON mode: one compact object, nothing else on stdout.
 */
final class ResultPrinter {

    static final String NO_SESSION = "(none)";

    private final PrintStream out;
    private final ObjectMapper objectMapper;

    ResultPrinter(PrintStream out, ObjectMapper objectMapper) {
        this.out = out;
        this.objectMapper = objectMapper;
    }

    /**
     * @param session     session id, {@link #NO_SESSION} for an unsaved ask, null to omit the header
     */
    void print(ChatResult result, String prompt, String sysprompt, String session, boolean json) {
        if (json) {
            out.println(toJson(result, prompt, sysprompt, session));
            return;
        }
        if (session != null) {
            out.println("session: " + session);
        }
        if (result.hasReasoning()) {
            out.println("reasoning:");
            out.println(result.reasoning());
            out.println();
            out.println("response:");
        }
        out.println(result.content());
    }

    private String toJson(ChatResult result, String prompt, String sysprompt, String session) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("response", result.content());
        if (prompt != null) payload.put("prompt", prompt);
        if (session != null && !NO_SESSION.equals(session)) payload.put("session", session);
        if (sysprompt != null && !sysprompt.isBlank()) payload.put("sysprompt", sysprompt);
        if (result.hasReasoning()) payload.put("reasoning", result.reasoning());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MqException("Failed to serialize result: " + e.getOriginalMessage(), e);
        }
    }
}
