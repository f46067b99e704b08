package io.stageflow.units.files;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stageflow.core.error.StageExecutionException;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.spi.PostProcessor;
import io.stageflow.core.spi.UnitConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the list payload of a stage as a JSON manifest to {@code output-file}. {@link FileDigest}
 * entries are written field by field; any other entry is written as its string form under
 * {@code path}. The payload passes through unchanged; metadata gains {@value #META_MANIFEST_PATH}.
 */
public final class ManifestWriterPostProcessor implements PostProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestWriterPostProcessor.class);

    public static final String ID = "manifest-writer";
    public static final String META_MANIFEST_PATH = "manifest-path";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path outputFile;
    private final boolean pretty;

    public ManifestWriterPostProcessor(UnitSpec spec) {
        UnitConfig config = UnitConfig.of(spec);
        this.outputFile = Path.of(config.requireString("output-file"));
        this.pretty = config.getBoolean("pretty", true);
    }

    @Override
    public boolean validateInput(ProcessorOutput output) {
        return output.data() instanceof List<?>;
    }

    @Override
    public ProcessorOutput postProcess(ProcessorOutput output, ExecutionContext context) {
        List<?> entries = output.data() instanceof List<?> list ? list : List.of();

        ObjectNode manifest = MAPPER.createObjectNode();
        manifest.put("pipeline", context.pipelineName());
        manifest.put("file-count", entries.size());
        ArrayNode files = manifest.putArray("files");
        for (Object entry : entries) {
            ObjectNode node = files.addObject();
            if (entry instanceof FileDigest digest) {
                node.put("path", digest.path().toString());
                node.put("size", digest.size());
                node.put("algorithm", digest.algorithm());
                node.put("digest", digest.digest());
            } else {
                node.put("path", String.valueOf(entry));
            }
        }

        ObjectWriter writer = pretty ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer.writeValue(outputFile.toFile(), manifest);
        } catch (IOException e) {
            throw new StageExecutionException("failed to write manifest " + outputFile + ": " + e.getMessage(), e);
        }
        LOG.info("Wrote manifest with {} entr{} to {}", entries.size(), entries.size() == 1 ? "y" : "ies", outputFile);
        return output.withMetadata(META_MANIFEST_PATH, outputFile.toString());
    }
}
