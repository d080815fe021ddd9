package com.deepansh.mq.batch;

/**
 * Outcome of a batch that ran to completion. Rows with a recorded error are counted,
 * they do not abort the run.
 */
public record BatchSummary(int total, int errored) {

    public boolean allSucceeded() {
        return errored == 0;
    }
}
