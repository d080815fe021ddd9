package com.deepansh.mq.batch;

import com.deepansh.mq.exception.MqException;
import com.deepansh.mq.exception.UserException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs one request per row on W workers and writes the results in input order.
 *
 * Per run:
 * 1. Pre-flight: every row is checked for reserved keys. A conflict fails the batch
 *    before any request and before any output exists.
 * 2. All rows are submitted to a pool of exactly W threads.
 * 3. Completions feed an {@link OrderedEmitter}, which writes line i only after lines
 *    0..i-1, whatever order the workers finish in.
 * 4. A merge conflict (or any other exception escaping the row function) aborts the
 *    run: rows not yet started are skipped and cancelled, late results are dropped, the
 *    staged output is deleted. Rows that merely recorded an error do not abort.
 * 5. On success the staged output is committed and a {@link BatchSummary} returned.
 *
 * Row states only move forward: pending, dispatched, completed, emitted.
 */
@Slf4j
public class BatchDispatcher {

    private final WorkerPoolFactory poolFactory;
    private final ObjectMapper objectMapper;

    public BatchDispatcher(WorkerPoolFactory poolFactory, ObjectMapper objectMapper) {
        this.poolFactory = poolFactory;
        this.objectMapper = objectMapper;
    }

    /**
     * @param rows        input rows, indices 0..n-1 in input order
     * @param workers     pool size, at least 1
     * @param tagsEnabled whether tag:* keys are reserved too
     * @param processor   row function; records request failures on the row, throws only for fatal ones
     * @param output      opened only after pre-flight passes
     * @throws com.deepansh.mq.exception.MergeConflictException when a row collides with a reserved key
     */
    public BatchSummary dispatch(List<BatchRow> rows,
                                 int workers,
                                 boolean tagsEnabled,
                                 Function<BatchRow, Map<String, Object>> processor,
                                 Supplier<StagedOutput> output) {
        if (workers < 1) {
            throw new UserException("Worker count must be at least 1 (got " + workers + ")");
        }
        ReservedKeys.checkAll(rows, tagsEnabled);

        StagedOutput staged = output.get();
        OrderedEmitter emitter = new OrderedEmitter(staged.writer());
        ThreadPoolTaskExecutor pool = poolFactory.create(workers);
        CompletionService<Integer> completions = new ExecutorCompletionService<>(pool.getThreadPoolExecutor());
        List<Future<Integer>> futures = new ArrayList<>(rows.size());

        log.info("Dispatching {} rows on {} workers", rows.size(), workers);
        try {
            for (BatchRow row : rows) {
                futures.add(completions.submit(() -> {
                    if (emitter.isAborted()) {
                        return row.index();
                    }
                    try {
                        Map<String, Object> result = processor.apply(row);
                        emitter.complete(row.index(), render(result), result.containsKey(ReservedKeys.ERROR));
                        return row.index();
                    } catch (RuntimeException | Error e) {
                        // workers still holding queued rows must not start them
                        emitter.abort();
                        throw e;
                    }
                }));
            }

            for (int done = 0; done < rows.size(); done++) {
                Future<Integer> finished = completions.take();
                try {
                    finished.get();
                } catch (ExecutionException e) {
                    throw unwrap(e.getCause());
                }
            }

            staged.commit();
            BatchSummary summary = new BatchSummary(rows.size(), emitter.errored());
            log.info("Batch finished: {} rows, {} errored, peak held {}",
                    summary.total(), summary.errored(), emitter.peakHeld());
            return summary;

        } catch (InterruptedException e) {
            abort(emitter, futures, pool, staged);
            Thread.currentThread().interrupt();
            throw new MqException("Batch interrupted", e);
        } catch (RuntimeException | Error e) {
            abort(emitter, futures, pool, staged);
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private String render(Map<String, Object> row) {
        try {
            return objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new MqException("Failed to serialize batch row: " + e.getOriginalMessage(), e);
        }
    }

    private void abort(OrderedEmitter emitter, List<Future<Integer>> futures,
                       ThreadPoolTaskExecutor pool, StagedOutput staged) {
        emitter.abort();
        futures.forEach(f -> f.cancel(true));
        pool.getThreadPoolExecutor().shutdownNow();
        staged.abort();
        log.warn("Batch aborted after {} emitted rows; output discarded", emitter.emitted());
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) return runtime;
        if (cause instanceof Error error) throw error;
        if (cause instanceof IOException io) return new UncheckedIOException(io);
        return new MqException("Batch row failed: " + cause, cause);
    }
}
