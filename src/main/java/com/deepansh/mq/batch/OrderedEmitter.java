package com.deepansh.mq.batch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reassembles out-of-order completions into input order.
 *
 * Workers hand in (index, line). Under one lock the line goes into a holding map and
 * the map is drained to the writer for as long as the next expected index is present.
 * The writer is only ever touched inside that lock. Once aborted, nothing more is
 * written.
 */
class OrderedEmitter {

    private final Writer writer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, String> held = new HashMap<>();

    private int nextIndex;
    private int errored;
    private int peakHeld;
    private boolean aborted;

    OrderedEmitter(Writer writer) {
        this.writer = writer;
    }

    /** @return false when the run was already aborted and the line was dropped */
    boolean complete(int index, String line, boolean rowErrored) {
        lock.lock();
        try {
            if (aborted) return false;
            held.put(index, line);
            if (rowErrored) errored++;
            peakHeld = Math.max(peakHeld, held.size());
            String next;
            while ((next = held.remove(nextIndex)) != null) {
                writer.write(next);
                writer.write('\n');
                nextIndex++;
            }
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write batch output", e);
        } finally {
            lock.unlock();
        }
    }

    void abort() {
        lock.lock();
        try {
            aborted = true;
            held.clear();
        } finally {
            lock.unlock();
        }
    }

    boolean isAborted() {
        lock.lock();
        try {
            return aborted;
        } finally {
            lock.unlock();
        }
    }

    int emitted() {
        lock.lock();
        try {
            return nextIndex;
        } finally {
            lock.unlock();
        }
    }

    int errored() {
        lock.lock();
        try {
            return errored;
        } finally {
            lock.unlock();
        }
    }

    /** Largest number of completed lines ever waiting on a lower index. */
    int peakHeld() {
        lock.lock();
        try {
            return peakHeld;
        } finally {
            lock.unlock();
        }
    }
}
