package com.purchasingpower.plangraph.cli;

import com.purchasingpower.plangraph.PipelineComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Transducer Command Runner Tests")
class TransducerCommandRunnerTest {

    @TempDir
    Path tempDir;

    private TransducerCommandRunner runner;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        runner = new TransducerCommandRunner(PipelineComponents.analyzer(), PipelineComponents.synthesizer(),
                PipelineComponents.roundTripVerifier(), PipelineComponents.objectMapper());
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should print the recovered definition as JSON")
    void testAnalyze() throws Exception {
        // Given
        Path pipeline = write("research_pipeline.py", PipelineComponents.resource("pipelines/research_pipeline.py"));

        // When
        boolean ok = runner.execute(new DefaultApplicationArguments("--analyze=" + pipeline), out);

        // Then
        assertTrue(ok);
        assertThat(output())
                .contains("\"className\" : \"QueryExpander\"")
                .contains("\"variantKind\" : \"cachedllmtaskworker\"");
    }

    @Test
    @DisplayName("Should print the generated module for a payload")
    void testSynthesize() throws Exception {
        // Given
        Path payload = write("payload.json", PipelineComponents.resource("payloads/minimal_payload.json"));

        // When
        boolean ok = runner.execute(new DefaultApplicationArguments("--synthesize=" + payload), out);

        // Then
        assertTrue(ok);
        assertThat(output())
                .startsWith("# Auto-generated PlanAI module")
                .contains("class Router(TaskWorker):");
    }

    @Test
    @DisplayName("Should print the round-trip report")
    void testVerify() throws Exception {
        // Given
        Path pipeline = write("research_pipeline.py", PipelineComponents.resource("pipelines/research_pipeline.py"));

        // When
        boolean ok = runner.execute(new DefaultApplicationArguments("--verify=" + pipeline), out);

        // Then
        assertTrue(ok);
        assertThat(output()).contains("Definitions are equivalent");
    }

    @Test
    @DisplayName("Should print the error and report failure for a module that does not parse")
    void testAnalyzeFailure() throws Exception {
        // Given
        Path pipeline = write("broken.py", "class Broken(Task:\n    pass\n");

        // When
        boolean ok = runner.execute(new DefaultApplicationArguments("--analyze=" + pipeline), out);

        // Then
        assertFalse(ok);
        assertThat(output()).contains("\"kind\" : \"SYNTAX_ERROR\"");
    }

    @Test
    @DisplayName("Should do nothing without a command option")
    void testNoCommand() throws Exception {
        // When
        boolean ok = runner.execute(new DefaultApplicationArguments("--unrelated=1"), out);

        // Then
        assertTrue(ok);
        assertThat(output()).isEmpty();
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
