package com.autods.dispatch.cli;

import com.autods.core.engine.RunOrchestrator;
import com.autods.core.engine.RunRequest;
import com.autods.core.error.DataException;
import com.autods.core.events.EventBus;
import com.autods.core.memory.MemoryNote;
import com.autods.core.memory.MemoryStore;
import com.autods.core.model.DatasetShape;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.MemoryRecord;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReflectionStatus;
import com.autods.core.model.RunOutcome;
import com.autods.core.report.RunDirectoryVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the picocli command tree with mocked services.
 */
class CliTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    private RunOrchestrator orchestrator;
    private LoggingSystem loggingSystem;
    private MemoryStore memory;
    private RunDirectoryVerifier verifier;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        orchestrator = mock(RunOrchestrator.class);
        loggingSystem = mock(LoggingSystem.class);
        memory = mock(MemoryStore.class);
        verifier = mock(RunDirectoryVerifier.class);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int execute(String... args) {
        var command = new AutodsCommand(orchestrator, new EventBus(), loggingSystem);
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == MemoryCommand.class) {
                    return cls.cast(new MemoryCommand(memory));
                }
                if (cls == VerifyCommand.class) {
                    return cls.cast(new VerifyCommand(verifier));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        return new CommandLine(command, factory).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private RunOutcome outcome(Path dir) {
        var best = new ModelMetrics("Logistic", 0.9, 0.85, 0.8, 0.8, 0.85);
        return new RunOutcome(dir, "run-1", "fp", "target", List.of("Train baseline"), List.of("Train baseline"),
                1, 0, new Reflection(ReflectionStatus.OK, "Logistic", List.of(), List.of(), false),
                new EvaluationPayload(best, List.of(best), dir.resolve("confusion_matrix.png").toString(), ""));
    }

    // ===================================================================
    //  Run
    // ===================================================================

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("missing --data is a usage error")
        void missingData() {
            assertEquals(2, execute("--target", "y"));
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("missing --target is a usage error")
        void missingTarget() {
            assertEquals(2, execute("--data", "d.csv"));
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("success prints the output directory as the last stdout line")
        void success() {
            Path dir = tempDir.resolve("outputs").resolve("run-1");
            when(orchestrator.execute(any(RunRequest.class))).thenReturn(outcome(dir));

            assertEquals(0, execute("--data", "d.csv", "--target", "churn", "--seed", "7",
                    "--test_size", "0.3", "--max_replans", "2", "--output_root", "out"));

            List<String> lines = stdout().lines().filter(l -> !l.isBlank()).toList();
            assertEquals(dir.toString(), lines.get(lines.size() - 1));
            assertTrue(stdout().contains("Run Summary"));

            ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
            verify(orchestrator).execute(captor.capture());
            assertEquals(new RunRequest("d.csv", "churn", "out", 7, 0.3, 2), captor.getValue());
        }

        @Test
        @DisplayName("defaults apply when options are omitted")
        void defaults() {
            when(orchestrator.execute(any(RunRequest.class))).thenReturn(outcome(tempDir));

            execute("--data", "d.csv", "--target", "auto");

            verify(orchestrator).execute(new RunRequest("d.csv", "auto", RunRequest.DEFAULT_OUTPUT_ROOT,
                    RunRequest.DEFAULT_SEED, RunRequest.DEFAULT_TEST_SIZE, RunRequest.DEFAULT_MAX_REPLANS));
        }

        @Test
        @DisplayName("quiet prints only the path and raises the log level")
        void quiet() {
            when(orchestrator.execute(any(RunRequest.class))).thenReturn(outcome(tempDir));

            assertEquals(0, execute("--data", "d.csv", "--target", "y", "--quiet"));

            assertEquals(List.of(tempDir.toString()), stdout().lines().toList());
            verify(loggingSystem).setLogLevel(AutodsCommand.APP_LOGGER, LogLevel.WARN);
        }

        @Test
        @DisplayName("a pipeline failure exits 1 with the message on stderr")
        void failure() {
            when(orchestrator.execute(any(RunRequest.class))).thenThrow(new DataException("Dataset is empty: d.csv"));

            assertEquals(1, execute("--data", "d.csv", "--target", "y"));

            assertTrue(err.toString(StandardCharsets.UTF_8).contains("Dataset is empty: d.csv"));
            assertFalse(stdout().contains(tempDir.toString()));
        }
    }

    // ===================================================================
    //  Subcommands
    // ===================================================================

    @Nested
    @DisplayName("subcommands")
    class Subcommands {

        @Test
        @DisplayName("verify exits 0 for a complete directory")
        void verifyComplete() {
            when(verifier.verify(any(Path.class))).thenReturn(List.of());

            assertEquals(0, execute("verify", tempDir.toString()));
            verify(verifier).verify(tempDir);
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("verify exits 1 and lists problems")
        void verifyIncomplete() {
            when(verifier.verify(any(Path.class))).thenReturn(List.of("Missing or empty: metrics.json"));

            assertEquals(1, execute("verify", tempDir.toString()));
            assertTrue(err.toString(StandardCharsets.UTF_8).contains("metrics.json"));
        }

        @Test
        @DisplayName("memory lists records and the latest notes")
        void memory() {
            var metrics = new ModelMetrics("RandomForest", 0.9, 0.75, 0.7, 0.7, 0.75);
            when(memory.records()).thenReturn(Map.of("abcdef0123456789", new MemoryRecord(
                    "2026-01-01T00:00:00Z", "churn", new DatasetShape(200, 4), "RandomForest", metrics)));
            when(memory.notes()).thenReturn(List.of(
                    new MemoryNote("2026-01-01T00:00:00Z", "first"),
                    new MemoryNote("2026-01-02T00:00:00Z", "second")));

            assertEquals(0, execute("memory", "-n", "1"));

            String text = stdout();
            assertTrue(text.contains("abcdef0123456789"));
            assertTrue(text.contains("200x4"));
            assertTrue(text.contains("0.750"));
            assertTrue(text.contains("second"));
            assertFalse(text.contains("first"));
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("memory reports an empty store")
        void emptyMemory() {
            when(memory.records()).thenReturn(Map.of());
            when(memory.notes()).thenReturn(List.of());

            assertEquals(0, execute("memory"));
            assertTrue(stdout().contains("No datasets remembered yet."));
        }
    }
}
