package com.deepansh.mq.batch;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Batch output that only becomes visible on a fully successful run.
 *
 * Lines go to a temp file for the whole run. {@link #commit()} renames it over the
 * destination file (same directory, so the rename is atomic) or, for stdout, copies it
 * to the stream. {@link #abort()} deletes it. Closing without a commit aborts.
 */
@Slf4j
public class StagedOutput implements Closeable {

    private static final Set<PosixFilePermission> DEFAULT_OUTPUT = PosixFilePermissions.fromString("rw-r--r--");

    private final Path temp;
    private final Path destination;
    private final OutputStream stream;
    private final FileOutputStream fileOut;
    private final Writer writer;

    private boolean finished;

    private StagedOutput(Path temp, Path destination, OutputStream stream) throws IOException {
        this.temp = temp;
        this.destination = destination;
        this.stream = stream;
        this.fileOut = new FileOutputStream(temp.toFile());
        this.writer = new BufferedWriter(new OutputStreamWriter(fileOut, StandardCharsets.UTF_8));
    }

    /** Stages next to the destination so the final rename stays on one filesystem. */
    public static StagedOutput toFile(Path destination) {
        Path absolute = destination.toAbsolutePath();
        try {
            Path dir = absolute.getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, "." + absolute.getFileName() + ".", ".tmp");
            return new StagedOutput(temp, absolute, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage batch output for " + destination, e);
        }
    }

    public static StagedOutput toStream(OutputStream stream) {
        try {
            Path temp = Files.createTempFile("mq-batch-", ".jsonl.tmp");
            return new StagedOutput(temp, null, stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage batch output", e);
        }
    }

    public Writer writer() {
        return writer;
    }

    public void commit() {
        if (finished) throw new IllegalStateException("Batch output already finished");
        try {
            writer.flush();
            fileOut.getFD().sync();
            writer.close();
            if (destination != null) {
                Set<PosixFilePermission> permissions = existingPermissions(destination);
                move(temp, destination);
                applyPermissions(destination, permissions);
            } else {
                Files.copy(temp, stream);
                stream.flush();
                Files.deleteIfExists(temp);
            }
            finished = true;
        } catch (IOException e) {
            abort();
            throw new UncheckedIOException("Failed to commit batch output", e);
        }
    }

    /** Discards everything written so far. Safe to call more than once. */
    public void abort() {
        if (finished) return;
        finished = true;
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Closing staged output failed: {}", e.getMessage());
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove staged output {}: {}", temp, e.getMessage());
        }
    }

    @Override
    public void close() {
        abort();
    }

    Path tempFile() {
        return temp;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Set<PosixFilePermission> existingPermissions(Path path) {
        try {
            return Files.exists(path) ? Files.getPosixFilePermissions(path) : DEFAULT_OUTPUT;
        } catch (UnsupportedOperationException | IOException e) {
            return DEFAULT_OUTPUT;
        }
    }

    private static void applyPermissions(Path path, Set<PosixFilePermission> permissions) {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", path);
        } catch (IOException e) {
            log.warn("Could not set permissions on {}: {}", path, e.getMessage());
        }
    }
}
