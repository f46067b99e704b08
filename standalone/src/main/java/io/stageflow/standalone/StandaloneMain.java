package io.stageflow.standalone;

import io.stageflow.standalone.runner.PipelineRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command-line runner.
 *
 * <p>
 * Delegates to {@link PipelineRunner#run(String[], java.io.PrintStream)} and exits with its status:
 * 0 on success, 1 when the pipeline fails or cannot be loaded, 2 on invalid arguments.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config pipeline.yaml --dry-run})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = PipelineRunner.run(args, System.out);
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            status = PipelineRunner.EXIT_FAILURE;
        }
        System.exit(status);
    }
}
