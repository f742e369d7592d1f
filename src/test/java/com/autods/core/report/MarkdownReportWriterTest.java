package com.autods.core.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownReportWriterTest {

    @TempDir
    Path tempDir;

    private final MarkdownReportWriter writer = new MarkdownReportWriter();

    @Test
    @DisplayName("report carries every section in order")
    void sections() throws Exception {
        Path file = writer.write(tempDir, ReportFixtures.context(tempDir), "abc123def4567890",
                ReportFixtures.profile(), List.of("Train baseline", "Handle imbalance"),
                ReportFixtures.evaluation(tempDir.resolve("confusion_matrix.png")), ReportFixtures.reflection());

        assertEquals(tempDir.resolve(ArtifactWriter.REPORT), file);
        String md = Files.readString(file);

        int title = md.indexOf("# Agentic Data Scientist Report");
        int profile = md.indexOf("## Dataset Profile");
        int plan = md.indexOf("## Plan");
        int results = md.indexOf("## Results (Best Model)");
        int reflection = md.indexOf("## Reflection");
        int artefacts = md.indexOf("# Artefacts");
        assertTrue(title == 0);
        assertTrue(profile > title && plan > profile && results > plan);
        assertTrue(reflection > results && artefacts > reflection);

        assertTrue(md.contains("**Run ID:** `20260101_120000_abcd1234`"));
        assertTrue(md.contains("**Fingerprint:** `abc123def4567890`"));
        assertTrue(md.contains("- Rows: **200**"));
        assertTrue(md.contains("- Numeric (1): tenure"));
        assertTrue(md.contains("- Categorical (1): plan"));
        assertTrue(md.contains("- Handle imbalance"));
        assertTrue(md.contains("**Model:** `RandomForest`"));
        assertTrue(md.contains("- Balanced accuracy: **0.780**"));
        assertTrue(md.contains("```json"));
        assertTrue(md.contains("\"MajorityBaseline\""));
        assertTrue(md.contains("- Imbalance detected"));
    }

    @Test
    @DisplayName("empty lists render as (none)")
    void emptyLists() {
        var reflection = new com.autods.core.model.Reflection(com.autods.core.model.ReflectionStatus.OK,
                "RandomForest", List.of(), List.of(), false);
        String md = writer.render(ReportFixtures.context(tempDir), "fp", ReportFixtures.profile(), List.of(),
                ReportFixtures.evaluation(tempDir.resolve("cm.png")), reflection);

        String planSection = md.substring(md.indexOf("## Plan"), md.indexOf("## Results"));
        assertTrue(planSection.contains("- (none)"));
        String reflectionSection = md.substring(md.indexOf("## Reflection"), md.indexOf("# Artefacts"));
        assertTrue(reflectionSection.contains("- (none)"));
    }
}
