package com.deepansh.mq.exception;

public class SessionNotFoundException extends UserException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Unknown session id: '" + sessionId + "'");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
