package com.deepansh.mq.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseParserTest {

    private static Map<String, Object> withMessage(Map<String, Object> message) {
        return Map.of("choices", List.of(Map.of("message", message)));
    }

    @Test
    void content_plainString() {
        assertThat(ResponseParser.content(withMessage(Map.of("content", "hi")))).isEqualTo("hi");
    }

    @Test
    void content_blockList_joinsTextBlocks() {
        Map<String, Object> response = withMessage(Map.of("content", List.of(
                Map.of("type", "reasoning", "text", "hidden"),
                Map.of("type", "text", "text", "Hello "),
                Map.of("type", "output_text", "text", "world"))));

        assertThat(ResponseParser.content(response)).isEqualTo("Hello world");
    }

    @Test
    void content_missing_isNull() {
        assertThat(ResponseParser.content(Map.of("choices", List.of()))).isNull();
        assertThat(ResponseParser.content(withMessage(Map.of("role", "assistant")))).isNull();
    }

    @Test
    void reasoning_topLevelWins() {
        Map<String, Object> response = Map.of(
                "reasoning_content", "top",
                "choices", List.of(Map.of("reasoning", "choice")));

        assertThat(ResponseParser.reasoning(response)).isEqualTo("top");
    }

    @Test
    void reasoning_fromMessageField() {
        Map<String, Object> response = withMessage(Map.of("content", "a", "reasoning_content", "thought"));

        assertThat(ResponseParser.reasoning(response)).isEqualTo("thought");
    }

    @Test
    void reasoning_fromContentBlocks() {
        Map<String, Object> response = withMessage(Map.of("content", List.of(
                Map.of("type", "thinking", "text", "step 1"),
                Map.of("type", "thinking", "text", "step 2"),
                Map.of("type", "text", "text", "answer"))));

        assertThat(ResponseParser.reasoning(response)).isEqualTo("step 1\nstep 2");
    }

    @Test
    void reasoning_absentOrBlank_isNull() {
        assertThat(ResponseParser.reasoning(withMessage(Map.of("content", "a", "reasoning", "  ")))).isNull();
        assertThat(ResponseParser.reasoning(null)).isNull();
    }

    @Test
    void truncate_longText_isCutWithEllipsis() {
        String text = "x".repeat(1000);

        assertThat(ResponseParser.truncate(text)).hasSize(801).endsWith("…");
        assertThat(ResponseParser.truncate("short")).isEqualTo("short");
    }

    @Test
    void jsonSnippet_serializesValue() {
        assertThat(ResponseParser.jsonSnippet(new ObjectMapper(), Map.of("a", 1))).isEqualTo("{\"a\":1}");
        assertThat(ResponseParser.jsonSnippet(new ObjectMapper(), null)).isEmpty();
    }
}
