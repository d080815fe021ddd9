package com.deepansh.mq.exception;

public class NoSessionException extends UserException {

    public NoSessionException() {
        super("No previous conversation found");
    }
}
