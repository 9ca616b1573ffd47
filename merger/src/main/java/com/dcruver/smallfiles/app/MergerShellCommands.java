package com.dcruver.smallfiles.app;

import com.dcruver.smallfiles.config.MergerProperties;
import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.clustering.ClusteringResult;
import com.dcruver.smallfiles.domain.clustering.ClusteringStatistics;
import com.dcruver.smallfiles.domain.clustering.FileClusteringService;
import com.dcruver.smallfiles.domain.dendrogram.Dendrogram;
import com.dcruver.smallfiles.domain.dendrogram.DendrogramStatistics;
import com.dcruver.smallfiles.io.FileGenerator;
import com.dcruver.smallfiles.io.FileIndex;
import com.dcruver.smallfiles.io.FileMerger;
import com.dcruver.smallfiles.io.MetadataWriter;
import com.dcruver.smallfiles.reporting.NameNodeMemoryReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Spring Shell commands for generating, clustering and merging small files.
 * The last generated file list and clustering result are kept for the session.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class MergerShellCommands {

    private final FileClusteringService clusteringService;
    private final FileGenerator fileGenerator;
    private final FileMerger fileMerger;
    private final MetadataWriter metadataWriter;
    private final FileIndex fileIndex;
    private final NameNodeMemoryReport memoryReport;
    private final MergerProperties properties;

    private List<SmallFile> lastFiles = List.of();
    private ClusteringResult lastResult;

    @ShellMethod(key = "generate", value = "Generate small files with random sizes")
    public String generate(
        @ShellOption(defaultValue = "50") int count,
        @ShellOption(defaultValue = "file") String prefix) {
        try {
            lastFiles = fileGenerator.generate(count, prefix);
            lastResult = null;
            return "Generated " + lastFiles.size() + " files.\n\n" + FileGenerator.describe(lastFiles, 15);

        } catch (Exception e) {
            log.error("File generation failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "generate-scenario", value = "Generate files from a canned scenario (mixed, small, medium, large)")
    public String generateScenario(@ShellOption(defaultValue = "mixed") String name) {
        try {
            FileGenerator.Scenario scenario = FileGenerator.Scenario.fromName(name);
            lastFiles = fileGenerator.generateScenario(scenario);
            lastResult = null;
            return String.format("Generated %d files (scenario %s).\n\n", lastFiles.size(), scenario)
                + FileGenerator.describe(lastFiles, 15);

        } catch (Exception e) {
            log.error("Scenario generation failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "cluster", value = "Cluster the generated files under a maximum cluster size")
    public String cluster(@ShellOption(defaultValue = ShellOption.NULL) Double maxSize) {
        try {
            if (lastFiles.isEmpty()) {
                return "No files to cluster. Run 'generate' or 'generate-scenario' first.";
            }

            double ceiling = maxSize != null ? maxSize : properties.getMaxClusterSizeMb();
            lastResult = clusteringService.cluster(lastFiles, ceiling);

            StringBuilder sb = new StringBuilder();
            sb.append("Clustering completed.\n\n");
            sb.append(formatStatistics(lastResult.getStatistics()));
            if (lastResult.isTerminatedEarly()) {
                sb.append(String.format("\nStopped early: no remaining pair fits under %.2f MB.\n", ceiling));
            }
            sb.append("\nRun 'history' or 'dendrogram' to inspect merges, 'merge' to write containers.\n");
            return sb.toString();

        } catch (Exception e) {
            log.error("Clustering failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Show statistics of the last clustering run")
    public String stats() {
        if (lastResult == null) {
            return "No clustering result. Run 'cluster' first.";
        }
        Dendrogram dendrogram = clusteringService.dendrogramFor(lastResult, true);
        DendrogramStatistics treeStats = dendrogram.getStatistics();

        StringBuilder sb = new StringBuilder(formatStatistics(lastResult.getStatistics()));
        sb.append("\nMerge trees:\n");
        sb.append(String.format("- Trees: %d\n", treeStats.getTotalTrees()));
        sb.append(String.format("- Merges: %d\n", treeStats.getTotalMerges()));
        sb.append(String.format("- Max height: %d\n", treeStats.getMaxHeight()));
        sb.append(String.format("- Leaves: %d\n", treeStats.getTotalLeaves()));
        return sb.toString();
    }

    @ShellMethod(key = "history", value = "Show the merge history of the last clustering run")
    public String history() {
        if (lastResult == null) {
            return "No clustering result. Run 'cluster' first.";
        }
        return clusteringService.dendrogramFor(lastResult, false).renderMergeHistory();
    }

    @ShellMethod(key = "dendrogram", value = "Render the merge trees of the last clustering run")
    public String dendrogram(@ShellOption(defaultValue = "false") boolean full) {
        try {
            if (lastResult == null) {
                return "No clustering result. Run 'cluster' first.";
            }
            return clusteringService.dendrogramFor(lastResult, full).renderTree();

        } catch (Exception e) {
            log.error("Dendrogram rendering failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "merge", value = "Write merged containers, metadata and index for the last clustering run")
    public String merge() {
        try {
            if (lastResult == null) {
                return "No clustering result. Run 'cluster' first.";
            }

            List<FileCluster> clusters = lastResult.getClusters();
            List<Path> containers = fileMerger.mergeAllClusters(clusters);
            Path summaryPath = metadataWriter.writeAllMetadata(clusters);
            metadataWriter.writeMergeHistory(lastResult.getMergeHistory());
            Path reportPath = metadataWriter.writeDetailedReport(lastResult, lastFiles.size());
            fileIndex.buildIndex(clusters);

            FileMerger.MergeSummary summary = fileMerger.getMergeSummary(clusters);

            StringBuilder sb = new StringBuilder();
            sb.append("Merge completed.\n\n");
            sb.append(String.format("- Containers written: %d\n", containers.size()));
            sb.append(String.format("- Files merged: %d\n", summary.getTotalFiles()));
            sb.append(String.format("- Total size: %.2f MB\n", summary.getTotalSizeMb()));
            sb.append(String.format("- File reduction: %.2f%%\n", summary.getReductionRate()));
            sb.append(String.format("- Output directory: %s\n", summary.getOutputDirectory()));
            sb.append(String.format("- Metadata: %s\n", summaryPath.getFileName()));
            sb.append(String.format("- Report: %s\n", reportPath.getFileName()));
            sb.append("\nUse 'locate' or 'extract' to find an original file.\n");
            return sb.toString();

        } catch (Exception e) {
            log.error("Merge failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "memory", value = "Compare NameNode metadata memory before and after merging")
    public String memory() {
        if (lastResult == null) {
            return "No clustering result. Run 'cluster' first.";
        }
        return memoryReport.buildReport(lastFiles, lastResult.getClusters());
    }

    @ShellMethod(key = "locate", value = "Show which container holds a file and where")
    public String locate(@ShellOption String name) {
        return fileIndex.getFileLocation(name)
            .map(location -> String.format("%s -> %s (offset %d, %d bytes)",
                name, FileMerger.containerName(location.clusterId()), location.offset(), location.length()))
            .orElse("File not indexed: " + name + ". Run 'merge' first.");
    }

    @ShellMethod(key = "extract", value = "Read a file back out of its merged container")
    public String extract(@ShellOption String name) {
        try {
            Optional<byte[]> content = fileIndex.extractFile(name, fileMerger.getOutputDir());
            if (content.isEmpty()) {
                return "File not found: " + name;
            }
            byte[] bytes = content.get();
            int headerEnd = 0;
            while (headerEnd < bytes.length && bytes[headerEnd] != '\n') {
                headerEnd++;
            }
            return String.format("Extracted %s: %d bytes, header '%s'",
                name, bytes.length, new String(bytes, 0, headerEnd, StandardCharsets.UTF_8));

        } catch (Exception e) {
            log.error("Extraction failed", e);
            return "Failed: " + e.getMessage();
        }
    }

    private String formatStatistics(ClusteringStatistics stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("Clustering Statistics:\n");
        sb.append(String.format("- Clusters: %d\n", stats.getNumClusters()));
        sb.append(String.format("- Files: %d\n", stats.getTotalFiles()));
        sb.append(String.format("- Average cluster size: %.2f MB\n", stats.getAvgClusterSizeMb()));
        sb.append(String.format("- Min cluster size: %.2f MB\n", stats.getMinClusterSizeMb()));
        sb.append(String.format("- Max cluster size: %.2f MB\n", stats.getMaxClusterSizeMb()));
        sb.append(String.format("- Average files per cluster: %.2f\n", stats.getAvgFilesPerCluster()));
        sb.append(String.format("- Merges: %d\n", stats.getIterations()));
        return sb.toString();
    }
}
