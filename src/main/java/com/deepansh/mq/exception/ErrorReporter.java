package com.deepansh.mq.exception;

import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The single place where failures become user-facing text.
 * Every exception that reaches the command boundary is printed to stderr and mapped
 * to exit code {@value #EXIT_ERROR}.
 */
@Slf4j
public class ErrorReporter {

    public static final int EXIT_ERROR = 2;

    private final PrintStream err;

    public ErrorReporter(PrintStream err) {
        this.err = err;
    }

    public int report(Throwable ex) {
        if (ex instanceof LlmException llm) {
            reportLlmError(llm);
        } else if (ex instanceof MqException) {
            log.debug("mq error: {}", ex.getMessage(), ex);
            err.println(ex.getMessage());
        } else if (ex instanceof UncheckedIOException io) {
            log.debug("I/O error", io);
            err.println(io.getMessage() + ": " + io.getCause().getMessage());
        } else {
            log.error("Unexpected error", ex);
            err.println("Unexpected error: " + ex);
        }
        return EXIT_ERROR;
    }

    /** {@code LLM error (provider=.., model=.., type=.., status=..): message} plus the raw body snippet. */
    private void reportLlmError(LlmException ex) {
        Map<String, Object> info = ex.getErrorInfo();
        List<String> parts = new ArrayList<>();
        addPart(parts, "provider", info.get("provider"));
        addPart(parts, "model", info.get("model"));
        addPart(parts, "type", info.get("type"));
        if (info.get("status_code") != null) {
            parts.add("status=" + info.get("status_code"));
        }

        String prefix = "LLM error";
        if (!parts.isEmpty()) {
            prefix += " (" + String.join(", ", parts) + ")";
        }
        err.println(prefix + ": " + (ex.getMessage() == null ? "" : ex.getMessage()));

        Object snippet = info.get("raw_response_snippet");
        if (isBlank(snippet)) snippet = info.get("raw_provider_response_snippet");
        if (!isBlank(snippet)) {
            err.println("raw: " + snippet);
        }
    }

    private static void addPart(List<String> parts, String name, Object value) {
        if (!isBlank(value)) parts.add(name + "=" + value);
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isEmpty();
    }
}
