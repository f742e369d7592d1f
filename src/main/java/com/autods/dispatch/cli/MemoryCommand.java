package com.autods.dispatch.cli;

import com.autods.core.memory.MemoryNote;
import com.autods.core.memory.MemoryStore;
import com.autods.core.model.MemoryRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI command: autods memory
 * <p>
 * Lists remembered datasets as a table: Fingerprint | Target | Shape | Best model | Balanced acc | Last seen,
 * followed by the most recent notes.
 */
@Command(name = "memory", mixinStandardHelpOptions = true, description = "Show remembered datasets and notes")
@Component
public class MemoryCommand implements Runnable {

    @Option(names = {"--notes", "-n"}, description = "Number of recent notes to show", defaultValue = "10")
    int notes;

    private final MemoryStore memory;

    public MemoryCommand(MemoryStore memory) {
        this.memory = memory;
    }

    @Override
    public void run() {
        Map<String, MemoryRecord> records = memory.records();
        if (records.isEmpty()) {
            ConsoleOutput.info("No datasets remembered yet.");
        } else {
            ConsoleOutput.info("Datasets (" + records.size() + "):");
            System.out.println();
            System.out.printf("  %-16s %-16s %-12s %-16s %-8s %s%n",
                    "FINGERPRINT", "TARGET", "SHAPE", "BEST MODEL", "BAL.ACC", "LAST SEEN");
            System.out.println("  " + "-".repeat(90));
            records.forEach((fingerprint, record) -> System.out.printf(Locale.ROOT,
                    "  %-16s %-16s %-12s %-16s %-8.3f %s%n",
                    fingerprint,
                    truncate(record.target(), 16),
                    record.shape() == null ? "-" : record.shape().rows() + "x" + record.shape().cols(),
                    truncate(record.bestModel(), 16),
                    record.bestMetrics() == null ? 0.0 : record.bestMetrics().balancedAccuracy(),
                    record.lastSeen()));
        }

        List<MemoryNote> allNotes = memory.notes();
        if (!allNotes.isEmpty() && notes > 0) {
            System.out.println();
            ConsoleOutput.info("Notes (latest " + Math.min(notes, allNotes.size()) + " of " + allNotes.size() + "):");
            allNotes.subList(Math.max(0, allNotes.size() - notes), allNotes.size())
                    .forEach(note -> System.out.println("  " + note.ts() + "  " + note.msg()));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
