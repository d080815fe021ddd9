package com.deepansh.mq.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One persisted conversation, stored as {@code sessions/<id>.json}.
 *
 * Field names are snake_case on disk. Top-level keys this class does not know about
 * are kept in {@link #extra} so a load/save cycle never drops them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"version", "id", "created_at", "updated_at", "model_shortname",
        "provider", "model", "sysprompt", "messages"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Session {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String id;

    /** ISO-8601 UTC, second precision. Lexicographic order equals time order. */
    private String createdAt;
    private String updatedAt;

    private String modelShortname;
    private String provider;
    private String model;
    private String sysprompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    /** Timestamp used for ordering: updated_at, else created_at, else empty. */
    public String sortKey() {
        if (updatedAt != null && !updatedAt.isEmpty()) return updatedAt;
        return createdAt != null ? createdAt : "";
    }

    /** Content of the first user message, or "" when there is none. */
    public String firstUserPrompt() {
        if (messages == null) return "";
        return messages.stream()
                .filter(m -> m != null && m.getRole() == Message.Role.user && m.getContent() != null)
                .map(Message::getContent)
                .findFirst()
                .orElse("");
    }
}
