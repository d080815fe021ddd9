package com.deepansh.mq.store;

import java.util.Optional;

/**
 * Durable record of which session is "current" for continue/dump.
 * Implementations never fail a read: a missing or unreadable pointer is just empty.
 */
public interface LatestPointer {

    Optional<String> read();

    void write(String sessionId);
}
