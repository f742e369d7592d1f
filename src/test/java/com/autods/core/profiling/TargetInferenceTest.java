package com.autods.core.profiling;

import com.autods.core.TestDatasets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TargetInferenceTest {

    @TempDir
    Path tempDir;

    private final TargetInference inference = new TargetInference();

    @Test
    @DisplayName("prefers a conventionally named column, case-insensitively")
    void preferredName() throws Exception {
        Path csv = TestDatasets.writeCsv(tempDir, "named.csv", List.of("Label,a,b", "x,1,2", "y,3,4"));
        assertEquals(Optional.of("Label"), inference.infer(TestDatasets.load(csv)));
    }

    @Test
    @DisplayName("'target' outranks 'class' when both exist")
    void preferenceOrder() throws Exception {
        Path csv = TestDatasets.writeCsv(tempDir, "both.csv", List.of("class,target,a", "x,p,1", "y,q,2"));
        assertEquals(Optional.of("target"), inference.infer(TestDatasets.load(csv)));
    }

    @Test
    @DisplayName("falls back to a low-cardinality last column")
    void lastColumn() throws Exception {
        Path csv = TestDatasets.writeCsv(tempDir, "last.csv", List.of("a,b,species", "1,2,cat", "3,4,dog", "5,6,cat"));
        assertEquals(Optional.of("species"), inference.infer(TestDatasets.load(csv)));
    }

    @Test
    @DisplayName("returns empty when the last column looks continuous")
    void noCandidate() throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add("a,amount");
        for (int i = 0; i < 80; i++) {
            lines.add(i + "," + (i * 0.37));
        }
        Path csv = TestDatasets.writeCsv(tempDir, "cont.csv", lines);
        assertTrue(inference.infer(TestDatasets.load(csv)).isEmpty());
    }
}
