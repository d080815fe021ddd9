package com.deepansh.mq.store;

import com.deepansh.mq.exception.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.UUID;

/**
 * Whole-file writes that readers never observe half done.
 *
 * Write path: temp file in the target's own directory, fsync, rename over the target,
 * chmod 600. The temp name is {@code <name>.<random>.tmp}, so a crash can leak a temp
 * file but never leaves a torn destination.
 */
@Slf4j
public class AtomicFileStore {

    static final String TEMP_SUFFIX = ".tmp";

    private static final Set<PosixFilePermission> OWNER_FILE = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> OWNER_DIR = PosixFilePermissions.fromString("rwx------");

    private final ObjectMapper objectMapper;
    private final ObjectMapper prettyMapper;

    public AtomicFileStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.prettyMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeAtomic(Path path, byte[] bytes) {
        Path parent = path.toAbsolutePath().getParent();
        ensureDirectory(parent);
        Path temp = parent.resolve(path.getFileName() + "." + UUID.randomUUID().toString().substring(0, 8) + TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp, path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        restrictToOwner(path, OWNER_FILE);
        log.debug("Wrote {} bytes to {}", bytes.length, path);
    }

    /** Pretty-printed JSON with a trailing newline. */
    public void writeJson(Path path, Object value) {
        try {
            String json = prettyMapper.writeValueAsString(value) + "\n";
            writeAtomic(path, json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to serialize JSON for " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a JSON document.
     *
     * @throws java.nio.file.NoSuchFileException when the file is absent, so callers can map
     *                                           that to their own not-found error
     * @throws ConfigException                   when the content is not valid JSON
     */
    public JsonNode readJson(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            JsonNode node = objectMapper.readTree(bytes);
            if (node == null || node.isMissingNode()) {
                throw new ConfigException("Invalid JSON in " + path + ": empty document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Idempotent; new directories are owner-only. */
    public void ensureDirectory(Path dir) {
        if (Files.isDirectory(dir)) return;
        try {
            Files.createDirectories(dir);
        } catch (FileAlreadyExistsException e) {
            if (!Files.isDirectory(dir)) {
                throw new UncheckedIOException("Not a directory: " + dir, e);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
        restrictToOwner(dir, OWNER_DIR);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // same directory, so this only happens on exotic filesystems
            log.debug("Atomic move not supported for {}, using plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void restrictToOwner(Path path, Set<PosixFilePermission> permissions) {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", path);
        } catch (IOException e) {
            log.warn("Could not restrict permissions on {}: {}", path, e.getMessage());
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
