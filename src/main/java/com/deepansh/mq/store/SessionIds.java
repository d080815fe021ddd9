package com.deepansh.mq.store;

import com.deepansh.mq.exception.UserException;

import java.util.UUID;
import java.util.regex.Pattern;

public final class SessionIds {

    public static final Pattern PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

    private SessionIds() {}

    public static boolean isValid(String id) {
        return id != null && PATTERN.matcher(id).matches();
    }

    public static void validate(String id) {
        if (id == null || id.isEmpty()) {
            throw new UserException("Session id must be non-empty");
        }
        if (!isValid(id)) {
            throw new UserException("Invalid session id (use only letters, digits, '_' and '-', no spaces)");
        }
    }

    /** 128 random bits as 32 lowercase hex characters. */
    public static String random() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
