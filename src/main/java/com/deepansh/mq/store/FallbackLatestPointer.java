package com.deepansh.mq.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Tries the preferred pointer and falls back to the second one on a platform error.
 *
 * The pointer is a convenience: if both writes fail the session itself is already
 * saved, so the failure is logged and the command carries on. loadLatestSession then
 * falls back to the newest session file.
 */
@Slf4j
public class FallbackLatestPointer implements LatestPointer {

    private final LatestPointer preferred;
    private final LatestPointer fallback;

    public FallbackLatestPointer(LatestPointer preferred, LatestPointer fallback) {
        this.preferred = preferred;
        this.fallback = fallback;
    }

    @Override
    public Optional<String> read() {
        Optional<String> id = preferred.read();
        return id.isPresent() ? id : fallback.read();
    }

    @Override
    public void write(String sessionId) {
        try {
            preferred.write(sessionId);
            return;
        } catch (RuntimeException e) {
            log.debug("Preferred latest pointer failed ({}), falling back", e.getMessage());
        }
        try {
            fallback.write(sessionId);
        } catch (RuntimeException e) {
            log.warn("Could not record latest session {}: {}", sessionId, e.getMessage());
        }
    }
}
