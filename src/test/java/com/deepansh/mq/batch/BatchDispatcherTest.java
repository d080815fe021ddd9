package com.deepansh.mq.batch;

import com.deepansh.mq.config.AsyncConfig;
import com.deepansh.mq.exception.MergeConflictException;
import com.deepansh.mq.exception.UserException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchDispatcherTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BatchDispatcher dispatcher;
    private Path outFile;

    @BeforeEach
    void setUp() {
        dispatcher = new BatchDispatcher(new AsyncConfig().batchWorkerPoolFactory(), objectMapper);
        outFile = tempDir.resolve("out.jsonl");
    }

    private static List<BatchRow> rows(int n) {
        List<BatchRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("n", i);
            fields.put("prompt", "p" + i);
            rows.add(new BatchRow(i, i + 1, fields));
        }
        return rows;
    }

    private static Map<String, Object> echo(BatchRow row) {
        Map<String, Object> out = new LinkedHashMap<>(row.fields());
        out.put("response", "r" + row.index());
        return out;
    }

    private List<Integer> outputOrder() throws Exception {
        List<Integer> order = new ArrayList<>();
        for (String line : Files.readAllLines(outFile)) {
            order.add(objectMapper.readTree(line).get("n").asInt());
        }
        return order;
    }

    private List<String> filesInTempDir() throws Exception {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).toList();
        }
    }

    @Test
    void dispatch_completionsInReverseOrder_outputInInputOrder() throws Exception {
        int n = 4;
        List<CountDownLatch> finished = new ArrayList<>();
        for (int i = 0; i <= n; i++) finished.add(new CountDownLatch(1));
        finished.get(n).countDown();

        Function<BatchRow, Map<String, Object>> processor = row -> {
            try {
                // row i finishes only after row i+1
                assertThat(finished.get(row.index() + 1).await(5, TimeUnit.SECONDS)).isTrue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            Map<String, Object> out = echo(row);
            finished.get(row.index()).countDown();
            return out;
        };

        BatchSummary summary = dispatcher.dispatch(rows(n), n, false, processor,
                () -> StagedOutput.toFile(outFile));

        assertThat(summary).isEqualTo(new BatchSummary(4, 0));
        assertThat(outputOrder()).containsExactly(0, 1, 2, 3);
    }

    @Test
    void dispatch_neverExceedsWorkerCount() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        dispatcher.dispatch(rows(12), 3, false, row -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(15);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return echo(row);
        }, () -> StagedOutput.toFile(outFile));

        assertThat(peak.get()).isBetween(1, 3);
        assertThat(outputOrder()).hasSize(12).isSorted();
    }

    @Test
    void dispatch_rowErrors_areCountedNotFatal() throws Exception {
        BatchSummary summary = dispatcher.dispatch(rows(3), 2, false, row -> {
            Map<String, Object> out = new LinkedHashMap<>(row.fields());
            if (row.index() == 1) out.put("error", "boom");
            else out.put("response", "ok");
            return out;
        }, () -> StagedOutput.toFile(outFile));

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.errored()).isEqualTo(1);
        assertThat(summary.allSucceeded()).isFalse();
        assertThat(Files.readAllLines(outFile)).hasSize(3);
        assertThat(Files.readAllLines(outFile).get(1)).contains("\"error\":\"boom\"");
    }

    @Test
    void dispatch_reservedKeyInInput_failsBeforeAnyRequestOrOutput() throws Exception {
        List<BatchRow> rows = new ArrayList<>(rows(2));
        rows.add(new BatchRow(2, 3, Map.of("prompt", "p", "response", "already")));
        AtomicBoolean outputOpened = new AtomicBoolean();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> dispatcher.dispatch(rows, 2, false, row -> {
            calls.incrementAndGet();
            return echo(row);
        }, () -> {
            outputOpened.set(true);
            return StagedOutput.toFile(outFile);
        }))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("merge conflict")
                .hasMessageContaining("line 3");

        assertThat(calls.get()).isZero();
        assertThat(outputOpened.get()).isFalse();
        assertThat(filesInTempDir()).isEmpty();
    }

    @Test
    void dispatch_reservedKeyAfterBlankLines_reportsInputLine() {
        List<BatchRow> rows = List.of(new BatchRow(0, 3, Map.of("prompt", "p", "error", "x")));

        assertThatThrownBy(() -> dispatcher.dispatch(rows, 1, false, BatchDispatcherTest::echo,
                () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("line 3")
                .hasMessageContaining("input already contains reserved key 'error'")
                .extracting(e -> ((MergeConflictException) e).getLineNumber())
                .isEqualTo(3);
    }

    @Test
    void dispatch_rowCarryingSysprompt_isConflictNotOverride() {
        List<BatchRow> rows = List.of(new BatchRow(0, 1, Map.of("prompt", "p", "sysprompt", "row level")));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> dispatcher.dispatch(rows, 1, false, row -> {
            calls.incrementAndGet();
            return echo(row);
        }, () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("'sysprompt'");
        assertThat(calls.get()).isZero();
    }

    @Test
    void dispatch_conflictOnFirstRow_stopsRowsNotYetStarted() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> dispatcher.dispatch(rows(50), 1, true, row -> {
            calls.incrementAndGet();
            if (row.index() == 0) throw MergeConflictException.tagCollision(row.lineNumber(), "tag:x");
            return echo(row);
        }, () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(MergeConflictException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(outFile).doesNotExist();
        assertThat(filesInTempDir()).isEmpty();
    }

    @Test
    void dispatch_tagKeyInInput_conflictsOnlyWhenExtractionEnabled() {
        List<BatchRow> rows = List.of(new BatchRow(0, 1, Map.of("prompt", "p", "tag:x", "1")));

        BatchSummary summary = dispatcher.dispatch(rows, 1, false, BatchDispatcherTest::echo,
                () -> StagedOutput.toFile(outFile));
        assertThat(summary.total()).isEqualTo(1);

        assertThatThrownBy(() -> dispatcher.dispatch(rows, 1, true, BatchDispatcherTest::echo,
                () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(MergeConflictException.class);
    }

    @Test
    void dispatch_conflictDuringRun_abortsAndLeavesExistingOutputUntouched() throws Exception {
        Files.writeString(outFile, "previous\n");

        assertThatThrownBy(() -> dispatcher.dispatch(rows(6), 2, true, row -> {
            if (row.index() == 3) throw MergeConflictException.tagCollision(row.lineNumber(), "tag:x");
            return echo(row);
        }, () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(MergeConflictException.class);

        assertThat(Files.readString(outFile)).isEqualTo("previous\n");
        assertThat(filesInTempDir()).containsExactly("out.jsonl");
    }

    @Test
    void dispatch_emptyInput_commitsEmptyOutput() throws Exception {
        BatchSummary summary = dispatcher.dispatch(List.of(), 2, false, BatchDispatcherTest::echo,
                () -> StagedOutput.toFile(outFile));

        assertThat(summary.total()).isZero();
        assertThat(outFile).exists();
        assertThat(Files.size(outFile)).isZero();
    }

    @Test
    void dispatch_zeroWorkers_isRejected() {
        assertThatThrownBy(() -> dispatcher.dispatch(rows(1), 0, false, BatchDispatcherTest::echo,
                () -> StagedOutput.toFile(outFile)))
                .isInstanceOf(UserException.class);
    }
}
