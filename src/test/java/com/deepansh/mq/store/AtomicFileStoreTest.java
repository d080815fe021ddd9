package com.deepansh.mq.store;

import com.deepansh.mq.exception.ConfigException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicFileStoreTest {

    @TempDir
    Path tempDir;

    private AtomicFileStore store;

    @BeforeEach
    void setUp() {
        store = new AtomicFileStore(new ObjectMapper());
    }

    @Test
    void writeAtomic_createsParentsAndOwnerOnlyFile() throws Exception {
        Path target = tempDir.resolve("a/b/state.json");

        store.writeAtomic(target, "hello".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("hello");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(target))).isEqualTo("rw-------");
    }

    @Test
    void writeAtomic_replacesExistingContentAndLeavesNoTempFiles() throws Exception {
        Path target = tempDir.resolve("state.json");
        store.writeAtomic(target, "first".getBytes(StandardCharsets.UTF_8));

        store.writeAtomic(target, "second".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("second");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("state.json");
        }
    }

    @Test
    void writeAtomic_parentIsAFile_throwsAndWritesNothing() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a dir");

        assertThatThrownBy(() -> store.writeAtomic(blocker.resolve("x.json"), new byte[]{1}))
                .isInstanceOf(UncheckedIOException.class);
        assertThat(blocker).hasContent("not a dir");
    }

    @Test
    void writeJson_prettyPrintsWithTrailingNewline() throws Exception {
        Path target = tempDir.resolve("doc.json");

        store.writeJson(target, Map.of("k", "v"));

        String text = Files.readString(target);
        assertThat(text).endsWith("}\n").contains("\"k\"").contains("\n");
        assertThat(store.readJson(target).get("k").asText()).isEqualTo("v");
    }

    @Test
    void readJson_missingFile_throwsNoSuchFile() {
        assertThatThrownBy(() -> store.readJson(tempDir.resolve("missing.json")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void readJson_invalidContent_throwsConfigException() throws Exception {
        Path target = tempDir.resolve("broken.json");
        Files.writeString(target, "{not json");

        assertThatThrownBy(() -> store.readJson(target))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void readJson_nonAsciiSurvives() throws Exception {
        Path target = tempDir.resolve("u.json");
        store.writeJson(target, Map.of("text", "héllo — 世界"));

        JsonNode node = store.readJson(target);

        assertThat(node.get("text").asText()).isEqualTo("héllo — 世界");
    }

    @Test
    void ensureDirectory_isIdempotent() {
        Path dir = tempDir.resolve("x/y");
        store.ensureDirectory(dir);
        store.ensureDirectory(dir);
        assertThat(dir).isDirectory();
    }
}
