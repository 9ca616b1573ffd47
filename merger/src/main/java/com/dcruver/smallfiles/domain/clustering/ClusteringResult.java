package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.ClusterDescriptor;
import com.dcruver.smallfiles.domain.FileCluster;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of one clustering run: the final clusters, the ordered merge history,
 * and the seed clusters the history starts from.
 */
@Value
@Builder
public class ClusteringResult {
    List<FileCluster> clusters;
    List<FileCluster> seedClusters;
    List<MergeRecord> mergeHistory;
    double maxClusterSizeMb;
    int iterations;

    // True when the loop stopped with several clusters because no pair fit under the ceiling
    boolean terminatedEarly;

    public static ClusteringResult empty(double maxClusterSizeMb) {
        return ClusteringResult.builder()
            .clusters(List.of())
            .seedClusters(List.of())
            .mergeHistory(List.of())
            .maxClusterSizeMb(maxClusterSizeMb)
            .build();
    }

    public List<ClusterDescriptor> getClusterDescriptors() {
        return clusters.stream().map(FileCluster::toDescriptor).toList();
    }

    public ClusteringStatistics getStatistics() {
        return ClusteringStatistics.of(clusters, iterations);
    }

    public int getClusterCount() {
        return clusters.size();
    }

    public int getTotalFiles() {
        return clusters.stream().mapToInt(FileCluster::size).sum();
    }
}
