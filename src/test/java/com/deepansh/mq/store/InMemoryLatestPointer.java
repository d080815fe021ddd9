package com.deepansh.mq.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Pointer double that records every write. */
class InMemoryLatestPointer implements LatestPointer {

    private String current;
    final List<String> writes = new ArrayList<>();

    @Override
    public Optional<String> read() {
        return Optional.ofNullable(current);
    }

    @Override
    public void write(String sessionId) {
        writes.add(sessionId);
        current = sessionId;
    }
}
