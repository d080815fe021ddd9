package com.deepansh.mq.exception;

public class BatchInputException extends UserException {

    private final int lineNumber;

    public BatchInputException(int lineNumber, String problem) {
        super("Invalid batch input at line " + lineNumber + ": " + problem);
        this.lineNumber = lineNumber;
    }

    public BatchInputException(int lineNumber, String problem, Throwable cause) {
        super("Invalid batch input at line " + lineNumber + ": " + problem, cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number in the input stream. */
    public int getLineNumber() {
        return lineNumber;
    }
}
