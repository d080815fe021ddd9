package com.deepansh.mq.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorReporterTest {

    private ByteArrayOutputStream err;
    private ErrorReporter reporter;

    @BeforeEach
    void setUp() {
        err = new ByteArrayOutputStream();
        reporter = new ErrorReporter(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void report_userError_printsMessage() {
        int code = reporter.report(new NoSessionException());

        assertThat(code).isEqualTo(ErrorReporter.EXIT_ERROR);
        assertThat(printed().strip()).isEqualTo("No previous conversation found");
    }

    @Test
    void report_llmError_printsOnlyKnownParts() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", "openai");
        info.put("type", "network_error");

        reporter.report(new LlmException("connection refused", info));

        assertThat(printed().strip()).isEqualTo("LLM error (provider=openai, type=network_error): connection refused");
    }

    @Test
    void report_llmErrorWithProviderSnippet_printsRawLine() {
        reporter.report(new LlmException("LLM response missing content",
                Map.of("raw_provider_response_snippet", "{\"choices\":[]}")));

        assertThat(printed()).contains("LLM error: LLM response missing content")
                .contains("raw: {\"choices\":[]}");
    }

    @Test
    void report_ioError_printsCause() {
        reporter.report(new UncheckedIOException("Failed to write /x", new IOException("disk full")));

        assertThat(printed()).contains("Failed to write /x").contains("disk full");
    }

    @Test
    void report_unexpected_exitsTwo() {
        assertThat(reporter.report(new IllegalStateException("boom"))).isEqualTo(2);
        assertThat(printed()).contains("boom");
    }
}
