package io.stageflow.standalone.runner;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.PipelineResult;
import io.stageflow.core.model.StageResult;
import io.stageflow.core.model.TransformerResult;
import java.io.PrintStream;
import java.util.List;

/** Prints the human-readable summary of a run to the runner's output stream. */
final class RunSummaryPrinter {

    static final int MAX_LISTED = 10;

    private RunSummaryPrinter() {
        // utility class
    }

    static void print(PipelineResult result, PrintStream out) {
        ExecutionContext context = result.context();
        out.println();
        out.println("Pipeline: " + result.pipelineName() + (result.dryRun() ? " (dry run)" : ""));
        out.println("Status: " + (result.success() ? "SUCCESS" : "FAILED"));
        if (!result.dryRun()) {
            out.println("Parallel execution: " + (context.isParallel() ? "ENABLED" : "DISABLED"));
            for (TransformerResult transformer : result.transformerResults()) {
                out.println("  " + transformer.transformerName() + ": " + (transformer.success() ? "ok" : "FAILED"));
                for (StageResult stage : transformer.stageResults()) {
                    out.println("    - " + stage.stageName() + ": " + stage.status());
                }
            }
        }
        out.println("Items processed: " + context.itemsProcessed());
        out.println("Errors: " + context.errors().size());
        out.println("Warnings: " + context.warnings().size());
        out.println("Duration: " + context.elapsed().toMillis() + " ms");
        list("Errors", context.errors(), out);
        list("Warnings", context.warnings(), out);
    }

    private static void list(String title, List<String> entries, PrintStream out) {
        if (entries.isEmpty()) {
            return;
        }
        out.println();
        out.println(title + ":");
        entries.stream().limit(MAX_LISTED).forEach(e -> out.println("  - " + e));
        if (entries.size() > MAX_LISTED) {
            out.println("  ... and " + (entries.size() - MAX_LISTED) + " more");
        }
    }
}
