package com.autods.core.nodes;

import com.autods.core.TestDatasets;
import com.autods.core.error.PlanningException;
import com.autods.core.model.RunContext;
import com.autods.core.profiling.DatasetLoader;
import com.autods.core.profiling.TargetInference;
import com.autods.core.state.RunDatasets;
import com.autods.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LoadDatasetNode}.
 */
class LoadDatasetNodeTest {

    @TempDir
    Path tempDir;

    private final RunDatasets datasets = new RunDatasets();
    private final LoadDatasetNode node = new LoadDatasetNode(new DatasetLoader(), new TargetInference(), datasets);

    private static RunState state(Path csv, String target) {
        return new RunState(Map.of(RunState.CONTEXT,
                new RunContext("run-1", "t", csv.toString(), target, "out", 42, 0.2, 1)));
    }

    @Test
    @DisplayName("registers the dataset and keeps an explicit target")
    void explicitTarget() throws Exception {
        Path csv = TestDatasets.separableThreeClass(tempDir, 5, 1);

        Map<String, Object> result = node.apply(state(csv, "b"));

        assertEquals("b", ((RunContext) result.get(RunState.CONTEXT)).target());
        assertEquals(15, datasets.get("run-1").numInstances());
    }

    @Test
    @DisplayName("resolves auto to the inferred column")
    void autoTarget() throws Exception {
        Path csv = TestDatasets.separableThreeClass(tempDir, 5, 1);

        Map<String, Object> result = node.apply(state(csv, "auto"));

        assertEquals("label", ((RunContext) result.get(RunState.CONTEXT)).target());
    }

    @Test
    @DisplayName("fails with a hint when no target can be inferred")
    void noCandidate() throws Exception {
        var lines = new java.util.ArrayList<String>(List.of("a,b"));
        for (int i = 0; i < 80; i++) {
            lines.add(i + "," + (i * 1.5));
        }
        Path csv = TestDatasets.writeCsv(tempDir, "wide.csv", lines);

        var ex = assertThrows(PlanningException.class, () -> node.apply(state(csv, "auto")));
        assertTrue(ex.getMessage().contains("--target"));
    }
}
