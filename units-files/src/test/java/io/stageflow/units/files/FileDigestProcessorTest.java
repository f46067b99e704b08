package io.stageflow.units.files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stageflow.core.model.ExecutionContext;
import io.stageflow.core.model.ProcessorInput;
import io.stageflow.core.model.ProcessorOutput;
import io.stageflow.core.model.ProcessorSpec;
import io.stageflow.core.parallel.TaskResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDigestProcessorTest {

    private static final String SHA256_HELLO = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";
    private static final String SHA256_EMPTY = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String MD5_HELLO = "5d41402abc4b2a76b9719d911017c592";

    @TempDir
    Path tempDir;

    private static FileDigestProcessor digester(Map<String, Object> config) {
        return new FileDigestProcessor(ProcessorSpec.of("digester", FileDigestProcessor.ID, config));
    }

    @Test
    void digestsEachFileAndCountsItems() throws IOException {
        Path hello = Files.writeString(tempDir.resolve("hello.txt"), "hello");
        Path other = Files.writeString(tempDir.resolve("other.txt"), "hello");
        ExecutionContext context = new ExecutionContext("digest-test");

        ProcessorOutput output = digester(Map.of()).process(ProcessorInput.of(List.of(other, hello)), context);

        assertThat(output.data()).asList().containsExactly(
                new FileDigest(hello, "SHA-256", SHA256_HELLO, 5), new FileDigest(other, "SHA-256", SHA256_HELLO, 5));
        assertThat(output.metadata())
                .containsEntry(FileDigestProcessor.META_ALGORITHM, "SHA-256")
                .containsEntry(FileDigestProcessor.META_DIGEST_COUNT, 2);
        assertThat(context.itemsProcessed()).isEqualTo(2);
        assertThat(context.errors()).isEmpty();
    }

    @Test
    void algorithmIsConfigurableAndPathStringsAreAccepted() throws IOException {
        Path hello = Files.writeString(tempDir.resolve("hello.txt"), "hello");

        ProcessorOutput output = digester(Map.of("algorithm", "MD5"))
                .process(ProcessorInput.of(List.of(hello.toString())), new ExecutionContext("p"));

        assertThat(output.data()).asList().singleElement()
                .isEqualTo(new FileDigest(hello, "MD5", MD5_HELLO, 5));
    }

    @Test
    void unknownAlgorithmFailsAtConstruction() {
        assertThatThrownBy(() -> digester(Map.of("algorithm", "ROT13")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown digest: ROT13");
    }

    @Test
    @DisplayName("unreadable files become errors and the rest still succeed")
    void missingFileIsRecordedNotThrown() throws IOException {
        Path hello = Files.writeString(tempDir.resolve("hello.txt"), "hello");
        Path ghost = tempDir.resolve("ghost.txt");
        ExecutionContext context = new ExecutionContext("p");

        ProcessorOutput output = digester(Map.of()).process(ProcessorInput.of(List.of(hello, ghost)), context);

        assertThat(output.data()).asList().hasSize(1);
        assertThat(context.itemsProcessed()).isEqualTo(1);
        assertThat(context.errors()).singleElement().asString().startsWith("Failed to digest " + ghost);
    }

    @Nested
    @DisplayName("parallel digesting")
    class Parallel {

        @Test
        @DisplayName("a pool of two gives the same result as a sequential run")
        void poolMatchesSequential() throws IOException {
            List<Path> files = List.of(
                    Files.writeString(tempDir.resolve("1.txt"), "one"),
                    Files.writeString(tempDir.resolve("2.txt"), "two"),
                    Files.writeString(tempDir.resolve("3.txt"), ""),
                    tempDir.resolve("4.txt"),
                    Files.writeString(tempDir.resolve("5.txt"), "five"));
            ExecutionContext sequentialContext = new ExecutionContext("p");
            ExecutionContext pooledContext = new ExecutionContext("p");

            ProcessorOutput sequential = digester(Map.of("parallel", false))
                    .process(ProcessorInput.of(files), sequentialContext);
            ProcessorOutput pooled = digester(Map.of("parallel", true, "max-workers", 2))
                    .process(ProcessorInput.of(files), pooledContext);

            assertThat(pooled.data()).isEqualTo(sequential.data());
            assertThat(pooledContext.itemsProcessed()).isEqualTo(4).isEqualTo(sequentialContext.itemsProcessed());
            assertThat(pooledContext.errors()).hasSize(1);
            assertThat(pooledContext.warnings())
                    .containsExactlyInAnyOrderElementsOf(sequentialContext.warnings())
                    .containsExactly("Empty file: " + tempDir.resolve("3.txt"));
        }

        @Test
        void globalFlagEnablesThePool() throws IOException {
            Path hello = Files.writeString(tempDir.resolve("hello.txt"), "hello");
            ExecutionContext context = new ExecutionContext("p");
            context.metadata().put(ExecutionContext.PARALLEL, true);

            ProcessorOutput output = digester(Map.of()).process(ProcessorInput.of(List.of(hello)), context);

            assertThat(output.data()).asList().hasSize(1);
        }
    }

    @Test
    void workerReportsEmptyFilesAsWarnings() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.bin"));

        TaskResult<FileDigest> result = digester(Map.of()).digest(empty);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload().digest()).isEqualTo(SHA256_EMPTY);
        assertThat(result.warnings()).containsExactly("Empty file: " + empty);
    }

    @Test
    void inputValidationWantsAList() {
        FileDigestProcessor digester = digester(Map.of());

        assertThat(digester.validateInput(ProcessorInput.of(List.of()))).isTrue();
        assertThat(digester.validateInput(ProcessorInput.of(tempDir))).isFalse();
    }
}
