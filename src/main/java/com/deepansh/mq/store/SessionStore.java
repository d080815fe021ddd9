package com.deepansh.mq.store;

import com.deepansh.mq.exception.ConfigException;
import com.deepansh.mq.exception.MqException;
import com.deepansh.mq.exception.NoSessionException;
import com.deepansh.mq.exception.SessionConflictException;
import com.deepansh.mq.exception.SessionNotFoundException;
import com.deepansh.mq.model.Message;
import com.deepansh.mq.model.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * File-backed conversation store.
 *
 * One JSON document per session under {@code sessions/}, written through
 * {@link AtomicFileStore}, plus the latest-session pointer. Every read hands back a
 * freshly deserialized {@link Session}; nothing returned is shared with the store.
 *
 * No locking: one CLI invocation at a time per home directory. Two concurrent writers
 * of the same session race and the last rename wins.
 */
@Slf4j
public class SessionStore {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final MqHome home;
    private final AtomicFileStore fileStore;
    private final LatestPointer latestPointer;
    private final Clock clock;

    public SessionStore(MqHome home, AtomicFileStore fileStore, LatestPointer latestPointer, Clock clock) {
        this.home = home;
        this.fileStore = fileStore;
        this.latestPointer = latestPointer;
        this.clock = clock;
    }

    public String createSession(String modelShortname, String provider, String model,
                                String sysprompt, List<Message> messages, String requestedId) {
        String id = reserveSessionId(requestedId);
        String now = now();
        Session session = Session.builder()
                .id(id)
                .createdAt(now)
                .updatedAt(now)
                .modelShortname(modelShortname)
                .provider(provider)
                .model(model)
                .sysprompt(sysprompt)
                .messages(new ArrayList<>(messages))
                .build();
        fileStore.writeJson(sessionPath(id), session);
        latestPointer.write(id);
        log.debug("Created session {} [model={}, messages={}]", id, modelShortname, messages.size());
        return id;
    }

    /**
     * Validates a requested id and checks it is free, or generates a random one.
     * Lets a caller fail on a taken id before it spends a model call.
     */
    public String reserveSessionId(String requestedId) {
        String id = requestedId != null ? requestedId : SessionIds.random();
        SessionIds.validate(id);
        if (Files.exists(sessionPath(id))) {
            throw new SessionConflictException(id);
        }
        return id;
    }

    public Session loadSession(String sessionId) {
        SessionIds.validate(sessionId);
        Path path = sessionPath(sessionId);
        JsonNode node;
        try {
            node = fileStore.readJson(path);
        } catch (NoSuchFileException e) {
            throw new SessionNotFoundException(sessionId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        if (!node.isObject()) {
            throw new ConfigException("Invalid session format in " + path);
        }
        return toSession(node, path);
    }

    /** Persists an appended turn: bumps updated_at, writes, repoints latest. Mutates the argument's updated_at. */
    public void saveSession(Session session) {
        String id = session.getId();
        if (id == null || id.isEmpty()) {
            throw new ConfigException("Invalid session (missing id)");
        }
        SessionIds.validate(id);
        session.setUpdatedAt(laterOf(now(), session.getUpdatedAt()));
        fileStore.writeJson(sessionPath(id), session);
        latestPointer.write(id);
        log.debug("Saved session {} [messages={}]", id,
                session.getMessages() == null ? 0 : session.getMessages().size());
    }

    /**
     * Resolution order: the pointer file as a full legacy document, then the pointer's
     * id, then the most recently modified session file.
     */
    public Session loadLatestSession() {
        Optional<Session> legacy = readLegacyPointerDocument();
        if (legacy.isPresent()) return legacy.get();

        Optional<String> pointed = latestPointer.read();
        if (pointed.isPresent()) {
            try {
                return loadSession(pointed.get());
            } catch (SessionNotFoundException e) {
                log.debug("Latest pointer names missing session {}, scanning", pointed.get());
            }
        }

        return newestSessionFile()
                .map(this::loadSession)
                .orElseThrow(NoSessionException::new);
    }

    /** All readable sessions, newest first by updated_at (else created_at). */
    public List<Session> listSessions() {
        List<Session> sessions = new ArrayList<>();
        for (Path path : sessionFiles()) {
            try {
                JsonNode node = fileStore.readJson(path);
                if (!node.isObject()) continue;
                Session session = toSession(node, path);
                if (session.getId() == null || session.getId().isEmpty()) {
                    session.setId(stem(path));
                }
                sessions.add(session);
            } catch (IOException | MqException e) {
                log.debug("Skipping unreadable session file {}: {}", path, e.getMessage());
            }
        }
        sessions.sort(Comparator.comparing(Session::sortKey).reversed());
        return sessions;
    }

    public void selectSession(String sessionId) {
        loadSession(sessionId);
        latestPointer.write(sessionId);
    }

    public void renameSession(String oldId, String newId) {
        SessionIds.validate(oldId);
        SessionIds.validate(newId);
        if (oldId.equals(newId)) return;

        Path oldPath = sessionPath(oldId);
        if (!Files.exists(oldPath)) {
            throw new SessionNotFoundException(oldId);
        }
        Path newPath = sessionPath(newId);
        if (Files.exists(newPath)) {
            throw new SessionConflictException(newId);
        }

        Session session = loadSession(oldId);
        session.setId(newId);
        session.setUpdatedAt(laterOf(now(), session.getUpdatedAt()));
        fileStore.writeJson(newPath, session);
        try {
            Files.delete(oldPath);
        } catch (IOException e) {
            log.warn("Renamed session {} -> {} but could not remove {}: {}", oldId, newId, oldPath, e.getMessage());
        }

        if (latestPointer.read().filter(oldId::equals).isPresent()) {
            latestPointer.write(newId);
        }
        log.debug("Renamed session {} -> {}", oldId, newId);
    }

    public boolean sessionExists(String sessionId) {
        return SessionIds.isValid(sessionId) && Files.exists(sessionPath(sessionId));
    }

    public Path sessionPath(String sessionId) {
        return home.sessionFile(sessionId);
    }

    private Optional<Session> readLegacyPointerDocument() {
        Path pointer = home.lastConversationFile();
        if (!Files.isRegularFile(pointer) || Files.isSymbolicLink(pointer)) return Optional.empty();
        try {
            JsonNode node = fileStore.readJson(pointer);
            JsonNode id = node.get("id");
            if (node.isObject() && id != null && id.isTextual() && !id.asText().isEmpty()) {
                return Optional.of(toSession(node, pointer));
            }
        } catch (IOException | MqException e) {
            log.debug("Latest pointer is not a session document: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<String> newestSessionFile() {
        return sessionFiles().stream()
                .filter(p -> SessionIds.isValid(stem(p)))
                .max(Comparator.comparing(this::modifiedTime))
                .map(this::stem);
    }

    private List<Path> sessionFiles() {
        Path dir = home.sessionsDir();
        fileStore.ensureDirectory(dir);
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + MqHome.SESSION_SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) files.add(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
        return files;
    }

    private FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private Session toSession(JsonNode node, Path source) {
        try {
            return fileStore.objectMapper().treeToValue(node, Session.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigException("Invalid session format in " + source + ": " + e.getMessage(), e);
        }
    }

    private String stem(Path path) {
        String name = path.getFileName().toString();
        return name.substring(0, name.length() - MqHome.SESSION_SUFFIX.length());
    }

    private String now() {
        return TIMESTAMP.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    // timestamps never move backwards, even if the wall clock does
    private static String laterOf(String candidate, String previous) {
        if (previous == null || previous.compareTo(candidate) <= 0) return candidate;
        return previous;
    }
}
