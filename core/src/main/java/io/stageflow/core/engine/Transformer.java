package io.stageflow.core.engine;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.StageResult;
import io.stageflow.core.model.TransformerResult;
import io.stageflow.core.model.TransformerSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Runtime transformer: an ordered list of {@link TransformerStage}s. */
public final class Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(Transformer.class);

    private final TransformerSpec spec;
    private final List<TransformerStage> stages;

    Transformer(TransformerSpec spec, List<TransformerStage> stages) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.stages = List.copyOf(stages);
    }

    public String name() {
        return spec.name();
    }

    public TransformerSpec spec() {
        return spec;
    }

    public List<TransformerStage> stages() {
        return stages;
    }

    public Optional<TransformerStage> stage(String stageName) {
        return stages.stream().filter(s -> s.name().equals(stageName)).findFirst();
    }

    /**
     * Runs the stages in order, threading each stage's output into the next one's input.
     *
     * <p>
     * A stage that throws, whether an exception or an {@link Error} other than a
     * {@link VirtualMachineError}, is recorded as {@code "<transformer>/<stage>: <message>"} in the
     * context errors and the remaining stages are reported as skipped. When {@code resumeStage}
     * is set, the stages declared before it are skipped as well and it receives {@code input}.
     */
    TransformerResult execute(
            ProcessorInput input, ExecutionContext context, String resumeStage, ListenerNotifier notifier) {
        int firstStage = resumeStage != null ? indexOf(resumeStage) : 0;
        List<StageResult> results = new ArrayList<>(stages.size());
        ProcessorInput current = input;
        boolean failed = false;

        for (int i = 0; i < stages.size(); i++) {
            TransformerStage stage = stages.get(i);
            if (i < firstStage || failed) {
                LOG.debug("Skipping stage '{}'", stage.name());
                results.add(StageResult.skipped(stage.name()));
                continue;
            }

            context.enterStage(name(), stage.name());
            MDC.put(PipelineEngine.MDC_STAGE, stage.name());
            try {
                LOG.info("Running stage '{}'", stage.name());
                ProcessorOutput output = stage.run(current, context);
                StageResult result = StageResult.succeeded(stage.name(), output);
                results.add(result);
                notifier.stageCompleted(name(), result);
                current = output.toInput();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                context.addError(name() + "/" + stage.name() + ": " + message);
                LOG.error("Stage '{}' failed: {}", stage.name(), message, e);
                StageResult result = StageResult.failed(stage.name(), message);
                results.add(result);
                notifier.stageFailed(name(), result);
                failed = true;
            } finally {
                MDC.remove(PipelineEngine.MDC_STAGE);
            }
        }
        return new TransformerResult(name(), !failed, results);
    }

    private int indexOf(String stageName) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(stageName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Transformer '" + name() + "' has no stage '" + stageName + "'");
    }

    @Override
    public String toString() {
        return "Transformer[" + name() + ", stages=" + stages.size() + "]";
    }
}
