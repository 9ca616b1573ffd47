package com.dcruver.smallfiles.app;

import com.dcruver.smallfiles.config.MergerProperties;
import com.dcruver.smallfiles.domain.clustering.FileClusteringService;
import com.dcruver.smallfiles.io.FileGenerator;
import com.dcruver.smallfiles.io.FileIndex;
import com.dcruver.smallfiles.io.FileMerger;
import com.dcruver.smallfiles.io.MetadataWriter;
import com.dcruver.smallfiles.reporting.NameNodeMemoryReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MergerShellCommandsTest {

    @TempDir
    Path tempDir;

    private MergerShellCommands commands;

    @BeforeEach
    void setUp() throws Exception {
        MergerProperties properties = new MergerProperties();
        properties.setOutputDir(tempDir.toString());
        properties.setMaxClusterSizeMb(1.0);
        properties.getGenerator().setMinSizeMb(0.001);
        properties.getGenerator().setMaxSizeMb(0.01);
        properties.getGenerator().setSeed(42L);

        commands = new MergerShellCommands(
            new FileClusteringService(),
            new FileGenerator(properties),
            new FileMerger(properties.getOutputDir()),
            new MetadataWriter(properties.getOutputDir()),
            new FileIndex(),
            new NameNodeMemoryReport(properties),
            properties);
    }

    @Test
    void testCommandsNeedPriorSteps() {
        assertTrue(commands.cluster(null).startsWith("No files to cluster"));
        assertEquals("No clustering result. Run 'cluster' first.", commands.stats());
        assertEquals("No clustering result. Run 'cluster' first.", commands.history());
        assertEquals("No clustering result. Run 'cluster' first.", commands.merge());
        assertEquals("No clustering result. Run 'cluster' first.", commands.memory());
        assertTrue(commands.locate("file_0001.dat").startsWith("File not indexed"));
    }

    @Test
    void testScenarioClusterAndInspect() {
        String generated = commands.generateScenario("large");
        assertTrue(generated.startsWith("Generated 18 files (scenario LARGE)"));

        // Smallest pair is 30 + 30 MB
        String clustered = commands.cluster(40.0);
        assertTrue(clustered.startsWith("Clustering completed."));
        assertTrue(clustered.contains("- Clusters: 18"));
        assertTrue(clustered.contains("- Merges: 0"));

        assertEquals("No merges recorded\n", commands.history());
        assertTrue(commands.dendrogram(false).contains("Tree 1"));
        assertTrue(commands.memory().contains("NAMENODE MEMORY CONSUMPTION"));
    }

    @Test
    void testMergeLocateAndExtract() {
        commands.generate(6, "tiny");
        // Six 0.01 MB files fit in one 1 MB cluster
        String clustered = commands.cluster(null);
        assertTrue(clustered.contains("- Clusters: 1"));
        assertTrue(clustered.contains("- Merges: 5"));

        String history = commands.history();
        assertTrue(history.contains("Merge 5:"));

        String merged = commands.merge();
        assertTrue(merged.startsWith("Merge completed."), merged);
        assertTrue(Files.exists(tempDir.resolve("cluster_11.bin")));
        assertTrue(Files.exists(tempDir.resolve("clusters_summary.json")));
        assertTrue(Files.exists(tempDir.resolve("merge_history.json")));
        assertTrue(Files.exists(tempDir.resolve("detailed_report.txt")));

        assertTrue(commands.locate("tiny_0003.dat").startsWith("tiny_0003.dat -> cluster_11.bin"));
        assertEquals("File not found: nope.dat", commands.extract("nope.dat"));
        assertTrue(commands.extract("tiny_0003.dat").contains("header 'FILE: tiny_0003.dat'"));
    }

    @Test
    void testStatsAfterClustering() {
        commands.generateScenario("small");
        commands.cluster(null);

        String stats = commands.stats();
        assertTrue(stats.contains("Clustering Statistics:"));
        assertTrue(stats.contains("Merge trees:"));
        assertTrue(stats.contains("- Leaves: 50"));
    }
}
