package com.deepansh.mq.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input record. fields keeps the input's key order; values are whatever Jackson
 * decoded (String, Number, Boolean, List, Map, null).
 *
 * @param index      0-based position in the input, which is also its output position
 * @param lineNumber 1-based line in the input stream, for error messages
 */
public record BatchRow(int index, int lineNumber, Map<String, Object> fields) {

    public BatchRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String prompt() {
        return (String) fields.get(ReservedKeys.PROMPT);
    }
}
