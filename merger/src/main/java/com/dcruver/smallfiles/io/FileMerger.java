package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes one container file per cluster by concatenating its members' content
 * in cluster order.
 */
@Component
@Slf4j
public class FileMerger {

    private final Path outputDir;

    public FileMerger(@Value("${merger.output-dir:output}") String outputDir) throws IOException {
        this.outputDir = Paths.get(outputDir).toAbsolutePath();
        Files.createDirectories(this.outputDir);
    }

    public static String containerName(int clusterId) {
        return "cluster_" + clusterId + ".bin";
    }

    /**
     * Write {@code cluster_<id>.bin} for the cluster
     *
     * @return path of the container
     */
    public Path mergeCluster(FileCluster cluster) throws IOException {
        Path container = outputDir.resolve(containerName(cluster.getClusterId()));

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(container))) {
            for (SmallFile file : cluster.getFiles()) {
                SimulatedContent.write(file, out);
            }
        }

        log.info("Created container {} ({} files, {} bytes)",
            container.getFileName(), cluster.size(), Files.size(container));
        return container;
    }

    public List<Path> mergeAllClusters(List<FileCluster> clusters) throws IOException {
        log.info("Merging {} clusters into {}", clusters.size(), outputDir);

        List<Path> containers = new ArrayList<>(clusters.size());
        for (FileCluster cluster : clusters) {
            containers.add(mergeCluster(cluster));
        }
        return containers;
    }

    public MergeSummary getMergeSummary(List<FileCluster> clusters) {
        int totalFiles = clusters.stream().mapToInt(FileCluster::size).sum();
        double totalSize = clusters.stream().mapToDouble(FileCluster::getTotalSize).sum();
        double reduction = totalFiles > 0 ? (1 - (double) clusters.size() / totalFiles) * 100 : 0;

        return MergeSummary.builder()
            .totalClusters(clusters.size())
            .totalFiles(totalFiles)
            .totalSizeMb(round2(totalSize))
            .reductionRate(round2(reduction))
            .outputDirectory(outputDir.toString())
            .build();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    @lombok.Value
    @Builder
    public static class MergeSummary {
        int totalClusters;
        int totalFiles;
        double totalSizeMb;
        double reductionRate;
        String outputDirectory;
    }
}
