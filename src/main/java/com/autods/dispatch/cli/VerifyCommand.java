package com.autods.dispatch.cli;

import com.autods.core.report.RunDirectoryVerifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: autods verify &lt;dir&gt;
 * <p>
 * Exits 0 when the run directory holds the full artifact set, 1 otherwise.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Check a run directory's artifacts")
@Component
public class VerifyCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<dir>", description = "Run output directory")
    Path runDir;

    private final RunDirectoryVerifier verifier;

    public VerifyCommand(RunDirectoryVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public Integer call() {
        List<String> problems = verifier.verify(runDir);
        if (problems.isEmpty()) {
            ConsoleOutput.success("Run directory complete: " + runDir);
            return 0;
        }
        problems.forEach(ConsoleOutput::error);
        return 1;
    }
}
