package com.deepansh.mq.store;

import java.nio.file.Path;

/**
 * Where mq keeps its state. Paths only; directories are created on first write.
 *
 * <pre>
 *   &lt;home&gt;/config.json
 *   &lt;home&gt;/sessions/&lt;id&gt;.json
 *   &lt;home&gt;/last_conversation.json
 * </pre>
 */
public record MqHome(Path root) {

    public static final String SESSION_SUFFIX = ".json";

    public Path configFile() {
        return root.resolve("config.json");
    }

    public Path sessionsDir() {
        return root.resolve("sessions");
    }

    public Path sessionFile(String sessionId) {
        return sessionsDir().resolve(sessionId + SESSION_SUFFIX);
    }

    public Path lastConversationFile() {
        return root.resolve("last_conversation.json");
    }

    /** Symlink target for the latest pointer, relative to the home directory. */
    public Path relativeSessionFile(String sessionId) {
        return Path.of("sessions", sessionId + SESSION_SUFFIX);
    }
}
