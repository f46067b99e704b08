package io.stageflow.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stageflow.core.error.CheckpointException;
import io.stageflow.core.model.Checkpoint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CheckpointStoreTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private static Checkpoint sample(String id) {
        return new Checkpoint(
                id,
                "nightly",
                AT,
                false,
                new Checkpoint.Summary(7, List.of("ingest/scan: boom"), List.of("slow disk"), Duration.ofMillis(1234)));
    }

    @Test
    @DisplayName("write creates the directory and the record reads back unchanged")
    void roundTrip() {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("nested/cp"));

        Path written = store.write(sample("run-1"));

        assertThat(written).isEqualTo(tempDir.resolve("nested/cp/run-1.json"));
        assertThat(store.exists("run-1")).isTrue();
        assertThat(store.read("run-1")).isEqualTo(sample("run-1"));
    }

    @Test
    void recordUsesKebabCaseFields() throws IOException {
        CheckpointStore store = new CheckpointStore(tempDir);
        store.write(sample("run-2"));

        JsonNode json = new ObjectMapper().readTree(tempDir.resolve("run-2.json").toFile());

        assertThat(json.get("checkpoint-id").asText()).isEqualTo("run-2");
        assertThat(json.get("pipeline-name").asText()).isEqualTo("nightly");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.at("/context/items-processed").asLong()).isEqualTo(7);
        assertThat(json.at("/context/errors/0").asText()).isEqualTo("ingest/scan: boom");
        assertThat(json.at("/context/elapsed-ms").asLong()).isEqualTo(1234);
    }

    @Test
    void rewritingReplacesTheRecordAndLeavesNoTempFiles() throws IOException {
        CheckpointStore store = new CheckpointStore(tempDir);
        store.write(sample("run-3"));
        Checkpoint second = new Checkpoint(
                "run-3", "nightly", AT.plusSeconds(60), true, new Checkpoint.Summary(9, List.of(), List.of(), null));

        store.write(second);

        assertThat(store.read("run-3")).isEqualTo(second);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("run-3.json");
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"../escape", "a/b", "", ".", "..", "with space"})
    void rejectsIdsThatAreNotPlainFileNames(String id) {
        CheckpointStore store = new CheckpointStore(tempDir);

        assertThatThrownBy(() -> store.pathFor(id))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid checkpoint id");
    }

    @Test
    void readingAMissingCheckpointFails() {
        CheckpointStore store = new CheckpointStore(tempDir);

        assertThatThrownBy(() -> store.read("absent"))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("Failed to read checkpoint 'absent'")
                .extracting(e -> ((CheckpointException) e).checkpointId())
                .isEqualTo("absent");
    }

    @Test
    void readingAMalformedRecordFails() throws IOException {
        Files.writeString(tempDir.resolve("junk.json"), "{\"checkpoint-id\": 1}");
        CheckpointStore store = new CheckpointStore(tempDir);

        assertThatThrownBy(() -> store.read("junk"))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("Malformed checkpoint record");
    }

    @Test
    void writeFailsWhenDirectoryIsAFile() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        CheckpointStore store = new CheckpointStore(blocker);

        assertThatThrownBy(() -> store.write(sample("run-4")))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("Failed to write checkpoint 'run-4'");
    }
}
