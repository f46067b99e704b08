package io.stageflow.core.testkit;

import io.stageflow.core.engine.UnitRegistry;
import io.stageflow.core.error.StageExecutionException;
import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.UnitSpec;
import io.stageflow.core.spi.PostProcessor;
import io.stageflow.core.spi.Processor;
import io.stageflow.core.spi.StageUnit;
import io.stageflow.core.spi.UnitProvider;
import java.util.List;
import java.util.Locale;

/** Small units used across the core tests. */
public final class TestUnits {

    public static final String RECORD = "record";
    public static final String FAIL = "fail";
    public static final String TAG_POST = "tag-post";
    public static final String GRUMPY = "grumpy";
    public static final String WARN = "warn";

    private TestUnits() {}

    /** Registry with the test units bound; {@code calls} receives "<unit name>" per invocation. */
    public static UnitRegistry registry(List<String> calls) {
        UnitRegistry registry = new UnitRegistry();
        registry.register(RECORD, spec -> new RecordingProcessor(spec.name(), calls));
        registry.register(FAIL, spec -> new FailingProcessor(spec.name(), calls));
        registry.register(TAG_POST, spec -> new TaggingPostProcessor(spec.name(), calls));
        registry.register(GRUMPY, spec -> new GrumpyProcessor());
        registry.register(WARN, spec -> new WarningProcessor(spec.name()));
        return registry;
    }

    /** Appends its name to a string payload ({@code a>b>c}) and counts one item. */
    public static final class RecordingProcessor implements Processor {

        private final String name;
        private final List<String> calls;

        public RecordingProcessor(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
            calls.add(name);
            context.incrementItems();
            String data = input.data() == null ? name : input.data() + ">" + name;
            return ProcessorOutput.of(data, input.metadata());
        }
    }

    /** Always fails with {@code "<name> exploded"}. */
    public static final class FailingProcessor implements Processor {

        private final String name;
        private final List<String> calls;

        public FailingProcessor(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
            calls.add(name);
            throw new StageExecutionException(name + " exploded");
        }
    }

    /** Marks the output with metadata {@code post=<name>}. */
    public static final class TaggingPostProcessor implements PostProcessor {

        private final String name;
        private final List<String> calls;

        public TaggingPostProcessor(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public ProcessorOutput postProcess(ProcessorOutput output, ExecutionContext context) {
            calls.add(name);
            return output.withMetadata("post", name);
        }
    }

    /** Passes data through but rejects both its input and its output. */
    public static final class GrumpyProcessor implements Processor {

        @Override
        public boolean validateInput(ProcessorInput input) {
            return false;
        }

        @Override
        public boolean validateOutput(ProcessorOutput output) {
            return false;
        }

        @Override
        public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
            return ProcessorOutput.passThrough(input);
        }
    }

    /** Records a warning and an error in the context without throwing. */
    public static final class WarningProcessor implements Processor {

        private final String name;

        public WarningProcessor(String name) {
            this.name = name;
        }

        @Override
        public ProcessorOutput process(ProcessorInput input, ExecutionContext context) {
            context.addWarning(name + ": something looks odd");
            context.addError(name + ": one item was bad");
            return ProcessorOutput.passThrough(input);
        }
    }

    /** Class-path provider for {@code uppercase}; listed in the test {@code META-INF/services}. */
    public static final class UppercaseProvider implements UnitProvider {

        @Override
        public String id() {
            return "uppercase";
        }

        @Override
        public StageUnit create(UnitSpec spec) {
            return (Processor) (input, context) ->
                    ProcessorOutput.of(String.valueOf(input.data()).toUpperCase(Locale.ROOT), input.metadata());
        }
    }

    /** Class-path provider whose id is blank; discovery must skip it. */
    public static final class BlankIdProvider implements UnitProvider {

        @Override
        public String id() {
            return " ";
        }

        @Override
        public StageUnit create(UnitSpec spec) {
            throw new UnsupportedOperationException("never created");
        }
    }
}
