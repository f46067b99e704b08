package io.stageflow.units.files;

import io.stageflow.core.error.StageExecutionException;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.spi.Processor;
import io.stageflow.core.spi.UnitConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the regular files of a directory.
 *
 * <p>
 * Config: {@code input-dir} (used when the input payload is not a {@link Path}), {@code glob}
 * matched against file names (default {@code *}), {@code recursive} (default {@code false}). The
 * output payload is the sorted {@code List<Path>}; metadata carries {@value #META_FILE_COUNT} and
 * {@value #META_INPUT_DIR}.
 */
public final class FileScanProcessor implements Processor {

    private static final Logger LOG = LoggerFactory.getLogger(FileScanProcessor.class);

    public static final String ID = "file-scan";
    public static final String META_FILE_COUNT = "file-count";
    public static final String META_INPUT_DIR = "input-dir";

    private final String name;
    private final Path inputDir;
    private final String glob;
    private final PathMatcher matcher;
    private final boolean recursive;

    public FileScanProcessor(UnitSpec spec) {
        UnitConfig config = UnitConfig.of(spec);
        this.name = spec.name();
        this.inputDir = config.getPath("input-dir", null);
        this.glob = config.getString("glob", "*");
        // invalid patterns fail here, at graph build time
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        this.recursive = config.getBoolean("recursive", false);
    }

    @Override
    public boolean validateInput(ProcessorInput input) {
        return input.data() == null || input.data() instanceof Path;
    }

    @Override
    public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
        Path dir = input.data() instanceof Path p ? p : inputDir;
        if (dir == null) {
            throw new StageExecutionException(
                    "no input directory: set 'input-dir' in the config of '" + name + "' or pass a Path payload");
        }
        if (!Files.isDirectory(dir)) {
            throw new StageExecutionException("input directory does not exist: " + dir);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir, recursive ? Integer.MAX_VALUE : 1)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new StageExecutionException("failed to scan " + dir + ": " + e.getMessage(), e);
        }
        LOG.info("Scanned {}: {} file(s) matching '{}'", dir, files.size(), glob);

        Map<String, Object> metadata = new LinkedHashMap<>(input.metadata());
        metadata.put(META_FILE_COUNT, files.size());
        metadata.put(META_INPUT_DIR, dir.toString());
        return ProcessorOutput.of(files, metadata);
    }
}
