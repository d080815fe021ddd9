package com.deepansh.mq.exception;

/**
 * The user asked for something that cannot be done: bad id syntax, unknown shortname,
 * conflicting flags. Reported, never retried.
 */
public class UserException extends MqException {

    public UserException(String message) {
        super(message);
    }

    public UserException(String message, Throwable cause) {
        super(message, cause);
    }
}
