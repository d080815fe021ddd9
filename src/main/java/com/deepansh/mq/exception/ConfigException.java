package com.deepansh.mq.exception;

/**
 * Persisted state is unreadable or structurally wrong (bad JSON, missing required fields).
 * Kept apart from {@link UserException} so diagnostics point at the file, not the command.
 */
public class ConfigException extends MqException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
