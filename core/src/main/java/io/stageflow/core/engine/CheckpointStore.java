package io.stageflow.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stageflow.core.error.CheckpointException;
import io.stageflow.core.model.Checkpoint;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link Checkpoint} records as {@code <directory>/<id>.json}.
 *
 * <p>
 * Writes go to a temporary file in the same directory and are then moved into place, so a reader
 * never sees a half-written record. Records are written once; saving the same id again replaces the
 * file as a whole.
 */
public final class CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]+");

    static final String FIELD_ID = "checkpoint-id";
    static final String FIELD_PIPELINE = "pipeline-name";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_SUCCESS = "success";
    static final String FIELD_CONTEXT = "context";
    static final String FIELD_ITEMS = "items-processed";
    static final String FIELD_ERRORS = "errors";
    static final String FIELD_WARNINGS = "warnings";
    static final String FIELD_ELAPSED_MS = "elapsed-ms";

    private final Path directory;

    public CheckpointStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path directory() {
        return directory;
    }

    /**
     * The file a checkpoint with this id is stored in.
     *
     * @throws IllegalArgumentException if the id is not a plain file-name token
     */
    public Path pathFor(String checkpointId) {
        requireValidId(checkpointId);
        return directory.resolve(checkpointId + ".json");
    }

    public boolean exists(String checkpointId) {
        return Files.isRegularFile(pathFor(checkpointId));
    }

    /**
     * Persists a checkpoint, creating the directory if needed.
     *
     * @return the written file
     * @throws CheckpointException if the record cannot be written
     */
    public Path write(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        Path target = pathFor(checkpoint.checkpointId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, checkpoint.checkpointId() + ".", ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), toJson(checkpoint));
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            CheckpointException failure = new CheckpointException(
                    "Failed to write checkpoint '" + checkpoint.checkpointId() + "' to " + target + ": "
                            + e.getMessage(),
                    e,
                    checkpoint.checkpointId(),
                    checkpoint.pipelineName());
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
        LOG.info("Checkpoint '{}' saved to {}", checkpoint.checkpointId(), target);
        return target;
    }

    /**
     * Reads a checkpoint back.
     *
     * @throws CheckpointException if the file is missing, unreadable or not a checkpoint record
     */
    public Checkpoint read(String checkpointId) {
        Path source = pathFor(checkpointId);
        JsonNode root;
        try {
            root = MAPPER.readTree(source.toFile());
        } catch (IOException e) {
            throw new CheckpointException(
                    "Failed to read checkpoint '" + checkpointId + "' from " + source + ": " + e.getMessage(),
                    e,
                    checkpointId,
                    null);
        }
        return fromJson(root, checkpointId, source);
    }

    private static ObjectNode toJson(Checkpoint checkpoint) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(FIELD_ID, checkpoint.checkpointId());
        root.put(FIELD_PIPELINE, checkpoint.pipelineName());
        root.put(FIELD_TIMESTAMP, checkpoint.timestamp().toString());
        root.put(FIELD_SUCCESS, checkpoint.success());

        Checkpoint.Summary summary = checkpoint.summary();
        ObjectNode context = root.putObject(FIELD_CONTEXT);
        context.put(FIELD_ITEMS, summary.itemsProcessed());
        ArrayNode errors = context.putArray(FIELD_ERRORS);
        summary.errors().forEach(errors::add);
        ArrayNode warnings = context.putArray(FIELD_WARNINGS);
        summary.warnings().forEach(warnings::add);
        context.put(FIELD_ELAPSED_MS, summary.elapsed().toMillis());
        return root;
    }

    private static Checkpoint fromJson(JsonNode root, String checkpointId, Path source) {
        JsonNode context = root.path(FIELD_CONTEXT);
        if (!root.isObject()
                || !root.path(FIELD_ID).isTextual()
                || !root.path(FIELD_PIPELINE).isTextual()
                || !root.path(FIELD_TIMESTAMP).isTextual()
                || !root.path(FIELD_SUCCESS).isBoolean()
                || !context.isObject()) {
            throw new CheckpointException(
                    "Malformed checkpoint record in " + source, checkpointId, textOrNull(root, FIELD_PIPELINE));
        }
        String pipelineName = root.get(FIELD_PIPELINE).asText();
        Instant timestamp;
        try {
            timestamp = Instant.parse(root.get(FIELD_TIMESTAMP).asText());
        } catch (DateTimeParseException e) {
            throw new CheckpointException(
                    "Malformed checkpoint timestamp in " + source + ": " + e.getMessage(), e, checkpointId, pipelineName);
        }
        Checkpoint.Summary summary = new Checkpoint.Summary(
                context.path(FIELD_ITEMS).asLong(0),
                textList(context.path(FIELD_ERRORS)),
                textList(context.path(FIELD_WARNINGS)),
                Duration.ofMillis(context.path(FIELD_ELAPSED_MS).asLong(0)));
        return new Checkpoint(
                root.get(FIELD_ID).asText(), pipelineName, timestamp, root.get(FIELD_SUCCESS).asBoolean(), summary);
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported in {}; falling back to a plain replace", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void requireValidId(String checkpointId) {
        Objects.requireNonNull(checkpointId, "checkpointId must not be null");
        if (!VALID_ID.matcher(checkpointId).matches() || checkpointId.equals(".") || checkpointId.equals("..")) {
            throw new IllegalArgumentException(
                    "Invalid checkpoint id '" + checkpointId + "': only letters, digits, '.', '_' and '-' are allowed");
        }
    }
}
