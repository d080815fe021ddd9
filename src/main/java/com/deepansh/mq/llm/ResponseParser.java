package com.deepansh.mq.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls answer text and reasoning traces out of OpenAI-style responses.
 *
 * Providers and gateways disagree on where reasoning lives, so several spellings are
 * probed in a fixed order: top level, then choices[0], then choices[0].message, then
 * typed content blocks.
 */
final class ResponseParser {

    static final int SNIPPET_LIMIT = 800;

    private static final List<String> TOP_LEVEL_KEYS = List.of("reasoning", "reasoning_content", "thinking", "thoughts");
    private static final List<String> CHOICE_KEYS = List.of("reasoning", "thinking", "thoughts");
    private static final List<String> TEXT_BLOCK_TYPES = List.of("text", "output_text");
    private static final List<String> REASONING_BLOCK_TYPES = List.of("reasoning", "thinking");

    private ResponseParser() {}

    /** Answer text of choices[0].message.content, or null when there is none. */
    static String content(Map<String, Object> response) {
        Map<String, Object> message = firstMessage(response);
        return message == null ? null : coerceContent(message.get("content"));
    }

    /** A plain string, or the text blocks of a content array joined; null if nothing usable. */
    static String coerceContent(Object rawContent) {
        if (rawContent instanceof String text) {
            return text;
        }
        if (rawContent instanceof List<?> items) {
            StringBuilder joined = new StringBuilder();
            for (Object item : items) {
                if (item instanceof String text) {
                    joined.append(text);
                } else if (item instanceof Map<?, ?> block && TEXT_BLOCK_TYPES.contains(block.get("type"))) {
                    String text = blockText(block);
                    if (text != null) joined.append(text);
                }
            }
            return joined.toString().isBlank() ? null : joined.toString();
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static String reasoning(Map<String, Object> response) {
        if (response == null) return null;

        String found = firstNonBlank(response, TOP_LEVEL_KEYS);
        if (found != null) return found;

        Object choices = response.get("choices");
        if (!(choices instanceof List<?> list) || list.isEmpty()) return null;
        if (!(list.get(0) instanceof Map<?, ?> choice0)) return null;

        found = firstNonBlank((Map<String, Object>) choice0, CHOICE_KEYS);
        if (found != null) return found;

        if (!(choice0.get("message") instanceof Map<?, ?> message)) return null;
        found = firstNonBlank((Map<String, Object>) message, TOP_LEVEL_KEYS);
        if (found != null) return found;

        if (message.get("content") instanceof List<?> blocks) {
            List<String> parts = new ArrayList<>();
            for (Object item : blocks) {
                if (item instanceof Map<?, ?> block && REASONING_BLOCK_TYPES.contains(block.get("type"))) {
                    String text = blockText(block);
                    if (text != null && !text.isBlank()) parts.add(text);
                }
            }
            if (!parts.isEmpty()) return String.join("\n", parts);
        }
        return null;
    }

    static String truncate(String text) {
        if (text == null || text.length() <= SNIPPET_LIMIT) return text;
        return text.substring(0, SNIPPET_LIMIT) + "…";
    }

    static String jsonSnippet(ObjectMapper objectMapper, Object value) {
        if (value == null) return "";
        String text;
        try {
            text = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            text = String.valueOf(value);
        }
        return truncate(text);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> firstMessage(Map<String, Object> response) {
        if (response == null) return null;
        if (!(response.get("choices") instanceof List<?> choices) || choices.isEmpty()) return null;
        if (!(choices.get(0) instanceof Map<?, ?> choice0)) return null;
        return choice0.get("message") instanceof Map<?, ?> message ? (Map<String, Object>) message : null;
    }

    private static String firstNonBlank(Map<String, Object> map, List<String> keys) {
        for (String key : keys) {
            if (map.get(key) instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String blockText(Map<?, ?> block) {
        Object text = block.get("text");
        if (text == null) text = block.get("content");
        return text instanceof String s ? s : null;
    }
}
