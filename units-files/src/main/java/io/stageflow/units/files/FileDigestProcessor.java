package io.stageflow.units.files;

import io.stageflow.core.error.StageExecutionException;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.parallel.AggregateResult;
import io.stageflow.core.parallel.ParallelOptions;
import io.stageflow.core.parallel.ParallelTaskRunner;
import io.stageflow.core.parallel.TaskResult;
import io.stageflow.core.spi.Processor;
import io.stageflow.core.spi.UnitConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Digests every file in the input payload (a list of {@link Path}s or path strings), one task per
 * file through {@link ParallelTaskRunner}.
 *
 * <p>
 * Config: {@code algorithm} (default {@value #DEFAULT_ALGORITHM}), plus the runner keys
 * {@code parallel}, {@code max-workers} and {@code batch-size}. Each digested file counts as one
 * processed item. A file that cannot be read is recorded as an error and left out of the output;
 * an empty file is digested with a warning. The output payload is the path-sorted
 * {@code List<FileDigest>}.
 */
public final class FileDigestProcessor implements Processor {

    private static final Logger LOG = LoggerFactory.getLogger(FileDigestProcessor.class);

    public static final String ID = "file-digest";
    public static final String DEFAULT_ALGORITHM = "SHA-256";
    public static final String META_ALGORITHM = "digest-algorithm";
    public static final String META_DIGEST_COUNT = "digest-count";

    private static final int BUFFER_SIZE = 64 * 1024;

    private final UnitConfig config;
    private final String algorithm;

    public FileDigestProcessor(UnitSpec spec) {
        this.config = UnitConfig.of(spec);
        this.algorithm = config.getString("algorithm", DEFAULT_ALGORITHM);
        try {
            MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException(
                    "Unit '" + spec.name() + "' config key 'algorithm' names an unknown digest: " + algorithm, e);
        }
    }

    @Override
    public boolean validateInput(ProcessorInput input) {
        return input.data() instanceof List<?>;
    }

    @Override
    public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
        List<Path> files = toPaths(input.data());
        ParallelOptions options = ParallelOptions.from(config, context);
        LOG.info(
                "Digesting {} file(s) with {} ({})",
                files.size(),
                algorithm,
                options.parallel() ? "pool of " + options.maxWorkers() : "sequential");

        AggregateResult<FileDigest> aggregate = ParallelTaskRunner.run(files, this::digest, options);
        aggregate.foldInto(context);

        List<FileDigest> digests = new ArrayList<>(aggregate.payloads());
        digests.sort(Comparator.comparing(FileDigest::path));

        Map<String, Object> metadata = new LinkedHashMap<>(input.metadata());
        metadata.put(META_ALGORITHM, algorithm);
        metadata.put(META_DIGEST_COUNT, digests.size());
        return ProcessorOutput.of(digests, metadata);
    }

    /** Worker: reads one file. Never touches the execution context. */
    TaskResult<FileDigest> digest(Path file) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            return TaskResult.failure("Failed to digest " + file + ": " + e.getMessage());
        }
        long size = 0;
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
                size += read;
            }
        } catch (IOException e) {
            LOG.warn("Failed to digest {}: {}", file, e.toString());
            return TaskResult.failure("Failed to digest " + file + ": " + e);
        }
        FileDigest result = new FileDigest(file, algorithm, HexFormat.of().formatHex(md.digest()), size);
        if (size == 0) {
            return TaskResult.successWithWarnings(result, List.of("Empty file: " + file));
        }
        return TaskResult.success(result);
    }

    private static List<Path> toPaths(Object payload) {
        if (!(payload instanceof List<?> list)) {
            throw new StageExecutionException("expected a list of paths as input, got: "
                    + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        List<Path> paths = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Path p) {
                paths.add(p);
            } else if (item instanceof String s) {
                paths.add(Path.of(s));
            } else {
                throw new StageExecutionException("expected a path, got: " + item);
            }
        }
        return paths;
    }
}
