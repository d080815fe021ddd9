package com.deepansh.mq.batch;

import com.deepansh.mq.exception.MergeConflictException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Output keys mq writes onto every batch row. An input row that already carries one of
 * them is a merge conflict. {@code prompt} is not reserved: it is the required input
 * field and gets overwritten with the final prompt.
 */
public final class ReservedKeys {

    public static final String PROMPT = "prompt";
    public static final String INPUT_PROMPT = "mq_input_prompt";
    public static final String RESPONSE = "response";
    public static final String REASONING = "reasoning";
    public static final String SYSPROMPT = "sysprompt";
    public static final String ERROR = "error";
    public static final String ERROR_INFO = "error_info";

    public static final String TAG_PREFIX = "tag:";

    public static final Set<String> RESERVED = Set.of(
            INPUT_PROMPT, RESPONSE, REASONING, SYSPROMPT, ERROR, ERROR_INFO);

    private ReservedKeys() {}

    public static boolean isReserved(String key, boolean tagsEnabled) {
        return RESERVED.contains(key) || (tagsEnabled && key.startsWith(TAG_PREFIX));
    }

    public static Optional<String> firstConflict(Map<String, ?> fields, boolean tagsEnabled) {
        return fields.keySet().stream()
                .filter(key -> isReserved(key, tagsEnabled))
                .findFirst();
    }

    /** Pre-flight: throws for the first row holding a reserved key. */
    public static void checkAll(List<BatchRow> rows, boolean tagsEnabled) {
        for (BatchRow row : rows) {
            Optional<String> conflict = firstConflict(row.fields(), tagsEnabled);
            if (conflict.isPresent()) {
                throw MergeConflictException.reservedInputKey(row.lineNumber(), conflict.get());
            }
        }
    }

    public static String tagKey(String tagName) {
        return TAG_PREFIX + tagName;
    }
}
