package com.deepansh.mq.exception;

/**
 * A batch row would overwrite one of mq's own output keys.
 * Always fatal to the whole batch: silently replacing the value would corrupt the output.
 */
public class MergeConflictException extends UserException {

    private final int lineNumber;
    private final String key;

    private MergeConflictException(int lineNumber, String key, String problem) {
        super(String.format("merge conflict on line %d: %s '%s'", lineNumber, problem, key));
        this.lineNumber = lineNumber;
        this.key = key;
    }

    /** The input row already carries a key mq writes. */
    public static MergeConflictException reservedInputKey(int lineNumber, String key) {
        return new MergeConflictException(lineNumber, key, "input already contains reserved key");
    }

    /** A tag extracted from the response would overwrite a key already on the output row. */
    public static MergeConflictException tagCollision(int lineNumber, String key) {
        return new MergeConflictException(lineNumber, key, "extracted tag would overwrite existing key");
    }

    /** 1-based line of the offending row in the input stream. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getKey() {
        return key;
    }
}
