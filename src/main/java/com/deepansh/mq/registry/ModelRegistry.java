package com.deepansh.mq.registry;

import com.deepansh.mq.exception.ConfigException;
import com.deepansh.mq.exception.UserException;
import com.deepansh.mq.model.ModelConfig;
import com.deepansh.mq.store.AtomicFileStore;
import com.deepansh.mq.store.MqHome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shortname to provider/model map kept in {@code config.json}:
 * <pre>{"version": 1, "models": {"gpt": {"provider": "openai", "model": "gpt-4o-mini", "sysprompt": null}}}</pre>
 *
 * A missing file reads as an empty registry. Entries are validated on read, so a
 * hand-edited file with a wrong field type fails with a {@link ConfigException}
 * naming the shortname.
 */
@Slf4j
public class ModelRegistry {

    public static final int CONFIG_VERSION = 1;

    private final MqHome home;
    private final AtomicFileStore fileStore;

    public ModelRegistry(MqHome home, AtomicFileStore fileStore) {
        this.home = home;
        this.fileStore = fileStore;
    }

    /** Adds or overwrites a shortname. */
    public void upsert(String shortname, ModelConfig config) {
        requireNonBlank(shortname, "Shortname");
        requireNonBlank(config.getProvider(), "Provider");
        requireNonBlank(config.getModel(), "Model");

        ObjectNode models = loadModels();
        models.set(shortname, fileStore.objectMapper().valueToTree(config));
        save(models);
        log.debug("Saved model {} -> {}/{}", shortname, config.getProvider(), config.getModel());
    }

    public ModelConfig get(String shortname) {
        JsonNode entry = loadModels().get(shortname);
        if (entry == null) {
            throw new UserException("Unknown model shortname: '" + shortname + "'");
        }
        return parseEntry(shortname, entry);
    }

    /** Every entry, sorted by shortname. */
    public Map<String, ModelConfig> list() {
        ObjectNode models = loadModels();
        Map<String, ModelConfig> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = models.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            sorted.put(field.getKey(), parseEntry(field.getKey(), field.getValue()));
        }
        return new LinkedHashMap<>(sorted);
    }

    public void remove(String shortname) {
        ObjectNode models = loadModels();
        if (models.remove(shortname) == null) {
            throw new UserException("Unknown model shortname: '" + shortname + "'");
        }
        save(models);
        log.debug("Removed model {}", shortname);
    }

    private ObjectNode loadModels() {
        Path path = home.configFile();
        JsonNode root;
        try {
            root = fileStore.readJson(path);
        } catch (NoSuchFileException e) {
            return JsonNodeFactory.instance.objectNode();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        if (!root.isObject()) {
            throw new ConfigException("Invalid config format in " + path + " (expected object)");
        }
        JsonNode version = root.get("version");
        if (version != null && !version.isInt()) {
            throw new ConfigException("Invalid config version in " + path);
        }
        JsonNode models = root.get("models");
        if (models == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!models.isObject()) {
            throw new ConfigException("Invalid models map in " + path);
        }
        return ((ObjectNode) models).deepCopy();
    }

    private void save(ObjectNode models) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("version", CONFIG_VERSION);
        root.set("models", models);
        fileStore.writeJson(home.configFile(), root);
    }

    private ModelConfig parseEntry(String shortname, JsonNode entry) {
        if (!entry.isObject()) {
            throw new ConfigException("Invalid model entry for '" + shortname + "'");
        }
        JsonNode provider = entry.get("provider");
        JsonNode model = entry.get("model");
        if (provider == null || !provider.isTextual() || model == null || !model.isTextual()) {
            throw new ConfigException("Invalid model entry for '" + shortname + "' (missing provider/model)");
        }
        JsonNode sysprompt = entry.get("sysprompt");
        if (present(sysprompt) && !sysprompt.isTextual()) {
            throw new ConfigException("Invalid sysprompt for '" + shortname + "' (expected string)");
        }
        JsonNode temperature = entry.get("temperature");
        if (present(temperature) && !temperature.isNumber()) {
            throw new ConfigException("Invalid temperature for '" + shortname + "' (expected number)");
        }
        JsonNode topP = entry.get("top_p");
        if (present(topP) && !topP.isNumber()) {
            throw new ConfigException("Invalid top_p for '" + shortname + "' (expected number)");
        }
        JsonNode topK = entry.get("top_k");
        if (present(topK) && !topK.isIntegralNumber()) {
            throw new ConfigException("Invalid top_k for '" + shortname + "' (expected int)");
        }

        return ModelConfig.builder()
                .provider(provider.asText())
                .model(model.asText())
                .sysprompt(present(sysprompt) ? sysprompt.asText() : null)
                .temperature(present(temperature) ? temperature.asDouble() : null)
                .topP(present(topP) ? topP.asDouble() : null)
                .topK(present(topK) ? topK.asInt() : null)
                .build();
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }

    private static void requireNonBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new UserException(what + " must be non-empty");
        }
    }
}
