package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.clustering.ClusteringResult;
import com.dcruver.smallfiles.domain.clustering.MergeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes cluster metadata as JSON and a plain-text report next to the containers.
 */
@Component
@Slf4j
public class MetadataWriter {

    static final String SUMMARY_FILE = "clusters_summary.json";
    static final String HISTORY_FILE = "merge_history.json";
    static final String REPORT_FILE = "detailed_report.txt";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public MetadataWriter(@Value("${merger.output-dir:output}") String outputDir) throws IOException {
        this.outputDir = Paths.get(outputDir).toAbsolutePath();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        Files.createDirectories(this.outputDir);
    }

    /**
     * JSON view of one cluster
     */
    record ClusterMetadata(int clusterId, List<String> files, int fileCount, double sizeTotalMb) {

        static ClusterMetadata of(FileCluster cluster) {
            return new ClusterMetadata(cluster.getClusterId(), cluster.getFileNames(),
                cluster.size(), FileMerger.round2(cluster.getTotalSize()));
        }
    }

    record ClustersSummary(Instant generatedAt, int totalClusters, List<ClusterMetadata> clusters,
                           Map<String, Object> summary) {
    }

    public Path writeClusterMetadata(FileCluster cluster) throws IOException {
        Path path = outputDir.resolve("cluster_" + cluster.getClusterId() + "_metadata.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), ClusterMetadata.of(cluster));
        return path;
    }

    /**
     * Write the summary file plus one metadata file per cluster
     *
     * @return path of the summary file
     */
    public Path writeAllMetadata(List<FileCluster> clusters) throws IOException {
        Path path = outputDir.resolve(SUMMARY_FILE);

        ClustersSummary summary = new ClustersSummary(
            Instant.now(),
            clusters.size(),
            clusters.stream().map(ClusterMetadata::of).toList(),
            buildSummary(clusters));
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), summary);
        log.info("Wrote metadata summary for {} clusters: {}", clusters.size(), path);

        for (FileCluster cluster : clusters) {
            writeClusterMetadata(cluster);
        }
        return path;
    }

    public Path writeMergeHistory(List<MergeRecord> history) throws IOException {
        Path path = outputDir.resolve(HISTORY_FILE);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), history);
        log.info("Wrote {} merge records: {}", history.size(), path);
        return path;
    }

    /**
     * Aggregate figures over the clusters; empty map for no clusters
     */
    Map<String, Object> buildSummary(List<FileCluster> clusters) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (clusters.isEmpty()) {
            return summary;
        }

        int totalFiles = clusters.stream().mapToInt(FileCluster::size).sum();
        double totalSize = clusters.stream().mapToDouble(FileCluster::getTotalSize).sum();

        summary.put("total_files", totalFiles);
        summary.put("total_size_mb", FileMerger.round2(totalSize));
        summary.put("average_cluster_size_mb", FileMerger.round2(totalSize / clusters.size()));
        summary.put("min_cluster_size_mb", FileMerger.round2(
            clusters.stream().mapToDouble(FileCluster::getTotalSize).min().orElse(0)));
        summary.put("max_cluster_size_mb", FileMerger.round2(
            clusters.stream().mapToDouble(FileCluster::getTotalSize).max().orElse(0)));
        summary.put("average_files_per_cluster", FileMerger.round2((double) totalFiles / clusters.size()));
        summary.put("min_files_per_cluster", clusters.stream().mapToInt(FileCluster::size).min().orElse(0));
        summary.put("max_files_per_cluster", clusters.stream().mapToInt(FileCluster::size).max().orElse(0));
        summary.put("file_reduction_rate_percent",
            FileMerger.round2((1 - (double) clusters.size() / totalFiles) * 100));
        return summary;
    }

    /**
     * Text report: clusters by id, member files by name
     */
    public Path writeDetailedReport(ClusteringResult result, int originalFileCount) throws IOException {
        Path path = outputDir.resolve(REPORT_FILE);
        List<FileCluster> clusters = result.getClusters();
        String rule = "=".repeat(80) + "\n";
        String thin = "-".repeat(80) + "\n";

        StringBuilder sb = new StringBuilder();
        sb.append(rule).append("SMALL FILE MERGE REPORT\n").append(rule).append("\n");
        sb.append(String.format("Original files: %d\n", originalFileCount));
        sb.append(String.format("Clusters created: %d\n", clusters.size()));
        sb.append(String.format("Max cluster size: %.2f MB\n", result.getMaxClusterSizeMb()));
        if (originalFileCount > 0) {
            sb.append(String.format("Reduction rate: %.2f%%\n", (1 - (double) clusters.size() / originalFileCount) * 100));
        }
        sb.append("\n").append(thin).append("CLUSTER DETAILS\n").append(thin).append("\n");

        clusters.stream()
            .sorted(Comparator.comparingInt(FileCluster::getClusterId))
            .forEach(cluster -> {
                sb.append(String.format("Cluster ID: %d\n", cluster.getClusterId()));
                sb.append(String.format("  Files: %d\n", cluster.size()));
                sb.append(String.format("  Total size: %.2f MB\n", cluster.getTotalSize()));
                sb.append("  Members:\n");
                cluster.getFiles().stream()
                    .sorted(Comparator.comparing(SmallFile::getName))
                    .forEach(file -> sb.append(String.format("    - %s (%.2f MB)\n", file.getName(), file.getSizeMb())));
                sb.append("\n");
            });

        sb.append(rule).append("END OF REPORT\n").append(rule);

        Files.writeString(path, sb.toString());
        log.info("Wrote detailed report: {}", path);
        return path;
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
