package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.dendrogram.Dendrogram;
import com.dcruver.smallfiles.domain.dendrogram.TreeDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for clustering small files and building merge trees.
 * Every call runs on a fresh engine, so results never share state.
 */
@Component
@Slf4j
public class FileClusteringService {

    /**
     * Group the files into clusters no larger than {@code maxClusterSizeMb}.
     */
    public ClusteringResult cluster(List<SmallFile> files, double maxClusterSizeMb) {
        return new AgglomerativeClustering().fit(files, maxClusterSizeMb);
    }

    /**
     * Forest with one leaf per final cluster
     */
    public List<TreeDescriptor> buildTree(ClusteringResult result) {
        return dendrogramFor(result, false).toDescriptors();
    }

    /**
     * Forest whose roots carry the full binary merge history
     */
    public List<TreeDescriptor> buildHistoryTree(ClusteringResult result) {
        return dendrogramFor(result, true).toDescriptors();
    }

    /**
     * Dendrogram loaded with the result's merge history.
     *
     * @param fullHistory replay merges over the seeds instead of using final clusters as leaves
     */
    public Dendrogram dendrogramFor(ClusteringResult result, boolean fullHistory) {
        Dendrogram dendrogram = new Dendrogram();
        for (MergeRecord merge : result.getMergeHistory()) {
            dendrogram.recordMerge(merge.parentAId(), merge.parentBId(), merge.childId(), merge.distance());
        }
        if (fullHistory) {
            dendrogram.buildFromHistory(result.getSeedClusters(), result.getClusters());
        } else {
            dendrogram.buildFromClusters(result.getClusters());
        }
        return dendrogram;
    }
}
