package com.deepansh.mq.exception;

/**
 * Root of every failure mq reports to the user.
 * Unchecked, like the rest of the service layer: callers catch it once at the CLI boundary.
 */
public class MqException extends RuntimeException {

    public MqException(String message) {
        super(message);
    }

    public MqException(String message, Throwable cause) {
        super(message, cause);
    }
}
