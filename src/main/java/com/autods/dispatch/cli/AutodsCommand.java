package com.autods.dispatch.cli;

import com.autods.core.engine.RunOrchestrator;
import com.autods.core.engine.RunRequest;
import com.autods.core.error.PipelineException;
import com.autods.core.events.EventBus;
import com.autods.core.events.RunEvent;
import com.autods.core.model.RunOutcome;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level CLI command: runs the pipeline on a dataset.
 * <p>
 * The output directory is always the last line written to stdout, so scripts can
 * capture it with {@code tail -n 1}. Logs go to stderr.
 */
@Command(
        name = "autods",
        mixinStandardHelpOptions = true,
        version = "autods 0.1.0",
        description = "Offline agentic data scientist: profile, plan, train, evaluate, reflect and replan",
        subcommands = {
                MemoryCommand.class,
                VerifyCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AutodsCommand implements Callable<Integer> {

    static final String APP_LOGGER = "com.autods";

    @Spec
    private CommandSpec spec;

    @Option(names = "--data", paramLabel = "<path>", description = "CSV or ARFF dataset")
    String data;

    @Option(names = "--target", paramLabel = "<name|auto>", description = "Target column, or 'auto' to infer it")
    String target;

    @Option(names = "--output_root", paramLabel = "<dir>", defaultValue = RunRequest.DEFAULT_OUTPUT_ROOT,
            description = "Directory for run outputs (default: ${DEFAULT-VALUE})")
    String outputRoot;

    @Option(names = "--seed", defaultValue = "42", description = "Random seed (default: ${DEFAULT-VALUE})")
    long seed;

    @Option(names = "--test_size", defaultValue = "0.2",
            description = "Held-out fraction, between 0 and 1 (default: ${DEFAULT-VALUE})")
    double testSize;

    @Option(names = "--max_replans", defaultValue = "1",
            description = "Maximum number of replans (default: ${DEFAULT-VALUE})")
    int maxReplans;

    @Option(names = "--quiet", description = "Only warnings and errors in the logs; no progress lines")
    boolean quiet;

    private final RunOrchestrator orchestrator;
    private final EventBus eventBus;
    private final LoggingSystem loggingSystem;

    public AutodsCommand(RunOrchestrator orchestrator, EventBus eventBus, LoggingSystem loggingSystem) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public Integer call() {
        // --data and --target are checked here rather than marked required so the subcommands parse without them
        if (data == null || data.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--data=<path>'");
        }
        if (target == null || target.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing required option: '--target=<name|auto>'");
        }

        if (quiet) {
            loggingSystem.setLogLevel(APP_LOGGER, LogLevel.WARN);
        } else {
            ConsoleOutput.printBanner();
        }

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(this::onEvent);
        try {
            RunOutcome outcome = orchestrator.execute(
                    new RunRequest(data, target, outputRoot, seed, testSize, maxReplans));
            if (!quiet) {
                ConsoleOutput.outcome(outcome);
            }
            ConsoleOutput.path(outcome.outputDir());
            return 0;
        } catch (PipelineException e) {
            ConsoleOutput.error(e.getClass().getSimpleName() + ": " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private void onEvent(RunEvent event) {
        ConsoleOutput.event(event);
    }
}
