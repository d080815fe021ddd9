package com.deepansh.mq.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * Pointer as a relative symlink {@code last_conversation.json -> sessions/<id>.json}.
 * Replaced by creating a fresh link beside it and renaming it over the old one.
 */
@Slf4j
public class SymlinkLatestPointer implements LatestPointer {

    private final MqHome home;

    public SymlinkLatestPointer(MqHome home) {
        this.home = home;
    }

    @Override
    public Optional<String> read() {
        Path link = home.lastConversationFile();
        if (!Files.isSymbolicLink(link)) return Optional.empty();
        try {
            Path target = Files.readSymbolicLink(link);
            Path name = target.getFileName();
            if (name == null) return Optional.empty();
            String fileName = name.toString();
            if (!fileName.endsWith(MqHome.SESSION_SUFFIX)) return Optional.empty();
            String id = fileName.substring(0, fileName.length() - MqHome.SESSION_SUFFIX.length());
            return SessionIds.isValid(id) ? Optional.of(id) : Optional.empty();
        } catch (IOException e) {
            log.debug("Unreadable latest-session symlink {}: {}", link, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws UnsupportedOperationException if the platform has no symlinks
     * @throws UncheckedIOException          if the link cannot be created or installed
     */
    @Override
    public void write(String sessionId) {
        Path link = home.lastConversationFile();
        Path temp = link.resolveSibling(link.getFileName() + "." + UUID.randomUUID().toString().substring(0, 8) + ".tmp");
        try {
            Files.createSymbolicLink(temp, home.relativeSessionFile(sessionId));
            Files.move(temp, link, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new UncheckedIOException("Failed to link " + link + " to session " + sessionId, e);
        }
        log.debug("Latest session -> {} (symlink)", sessionId);
    }
}
