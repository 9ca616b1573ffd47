package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.FileCluster;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Summary figures for a finished clustering run.
 */
@Value
@Builder
public class ClusteringStatistics {
    int numClusters;
    int totalFiles;
    double avgClusterSizeMb;
    double minClusterSizeMb;
    double maxClusterSizeMb;
    double avgFilesPerCluster;
    int iterations;

    public static ClusteringStatistics of(List<FileCluster> clusters, int iterations) {
        if (clusters.isEmpty()) {
            return ClusteringStatistics.builder().iterations(iterations).build();
        }

        int totalFiles = clusters.stream().mapToInt(FileCluster::size).sum();
        double totalSize = clusters.stream().mapToDouble(FileCluster::getTotalSize).sum();

        return ClusteringStatistics.builder()
            .numClusters(clusters.size())
            .totalFiles(totalFiles)
            .avgClusterSizeMb(totalSize / clusters.size())
            .minClusterSizeMb(clusters.stream().mapToDouble(FileCluster::getTotalSize).min().orElse(0))
            .maxClusterSizeMb(clusters.stream().mapToDouble(FileCluster::getTotalSize).max().orElse(0))
            .avgFilesPerCluster((double) totalFiles / clusters.size())
            .iterations(iterations)
            .build();
    }
}
