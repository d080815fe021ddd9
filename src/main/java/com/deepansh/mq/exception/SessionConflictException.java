package com.deepansh.mq.exception;

public class SessionConflictException extends UserException {

    private final String sessionId;

    public SessionConflictException(String sessionId) {
        super("Session already exists: '" + sessionId + "'");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
