package com.deepansh.mq.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Pointer as a regular file whose content is the session id.
 * Used where symlinks are unavailable.
 */
@Slf4j
public class PlainFileLatestPointer implements LatestPointer {

    private final MqHome home;
    private final AtomicFileStore fileStore;

    public PlainFileLatestPointer(MqHome home, AtomicFileStore fileStore) {
        this.home = home;
        this.fileStore = fileStore;
    }

    @Override
    public Optional<String> read() {
        Path file = home.lastConversationFile();
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            // a legacy pointer holds a whole session document, not an id
            return SessionIds.isValid(text) ? Optional.of(text) : Optional.empty();
        } catch (IOException e) {
            log.debug("Unreadable latest-session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(String sessionId) {
        Path file = home.lastConversationFile();
        if (Files.isSymbolicLink(file)) {
            try {
                Files.delete(file);
            } catch (IOException e) {
                log.debug("Could not remove stale symlink {}: {}", file, e.getMessage());
            }
        }
        fileStore.writeAtomic(file, (sessionId + "\n").getBytes(StandardCharsets.UTF_8));
        log.debug("Latest session -> {} (plain file)", sessionId);
    }
}
