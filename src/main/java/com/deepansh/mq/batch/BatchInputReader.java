package com.deepansh.mq.batch;

import com.deepansh.mq.exception.BatchInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads newline-delimited JSON batch input, all of it, before any request is made.
 *
 * Blank lines are skipped and do not consume a row index. Every other line must be a
 * JSON object with a string "prompt", with nothing after it; the first one that is not
 * fails the whole batch with its 1-based line number.
 */
public class BatchInputReader {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader lineReader;

    public BatchInputReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<BatchRow> read(BufferedReader reader) {
        List<BatchRow> rows = new ArrayList<>();
        int lineNumber = 0;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                rows.add(parseLine(line, lineNumber, rows.size()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read batch input after line " + lineNumber, e);
        }
        return rows;
    }

    private BatchRow parseLine(String line, int lineNumber, int index) {
        JsonNode node;
        try {
            node = lineReader.readTree(line);
        } catch (JsonProcessingException e) {
            throw new BatchInputException(lineNumber, "invalid JSON (" + e.getOriginalMessage() + ")", e);
        }
        if (node == null || !node.isObject()) {
            throw new BatchInputException(lineNumber, "expected a JSON object");
        }
        JsonNode prompt = node.get(ReservedKeys.PROMPT);
        if (prompt == null || !prompt.isTextual()) {
            throw new BatchInputException(lineNumber, "missing string field 'prompt'");
        }
        LinkedHashMap<String, Object> fields = objectMapper.convertValue(node, ROW_TYPE);
        return new BatchRow(index, lineNumber, fields);
    }
}
