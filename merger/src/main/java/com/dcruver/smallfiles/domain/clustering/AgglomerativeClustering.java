package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.ClusteringValidationException;
import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.dendrogram.Dendrogram;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy capacity-bounded single-linkage agglomeration.
 *
 * Each iteration sorts every live pair by distance and merges the first pair whose
 * combined size fits under the ceiling, then rescans. The run ends when one cluster
 * remains or no pair fits.
 *
 * An instance performs exactly one run; create a new one per input batch so cluster
 * ids restart at 1.
 */
@Slf4j
public class AgglomerativeClustering {

    private final ClusterIdSequence idSequence = new ClusterIdSequence();

    @Getter
    private final Dendrogram dendrogram = new Dendrogram();

    @Getter
    private EngineState state = EngineState.INITIALIZED;

    private DistanceMatrix distanceMatrix;
    private List<FileCluster> clusters = List.of();
    private int iterationCount;

    /**
     * Cluster the given files under a maximum aggregate size.
     *
     * @param files input files, in order; duplicates by name are kept as separate seeds
     * @param maxClusterSizeMb capacity ceiling for any cluster
     * @return final clusters with merge history
     * @throws ClusteringValidationException if the ceiling is not positive or a file is null
     */
    public ClusteringResult fit(List<SmallFile> files, double maxClusterSizeMb) {
        if (state != EngineState.INITIALIZED) {
            throw new IllegalStateException("Clustering run already used (state " + state + ")");
        }
        validate(files, maxClusterSizeMb);

        log.info("Starting agglomerative clustering: {} files, max cluster size {} MB, single linkage",
            files.size(), maxClusterSizeMb);

        if (files.isEmpty()) {
            state = EngineState.TERMINATED;
            log.info("No files to cluster");
            return ClusteringResult.empty(maxClusterSizeMb);
        }

        state = EngineState.SEEDING;
        List<FileCluster> seeds = initializeClusters(files);
        distanceMatrix = new DistanceMatrix(seeds, idSequence);
        log.debug("Initialized {} seed clusters", seeds.size());

        state = EngineState.AGGLOMERATING;
        boolean exhausted = agglomerate(maxClusterSizeMb);

        clusters = List.copyOf(distanceMatrix.getClusters());
        state = EngineState.TERMINATED;

        log.info("Clustering finished: {} clusters after {} merges", clusters.size(), iterationCount);

        return ClusteringResult.builder()
            .clusters(clusters)
            .seedClusters(seeds)
            .mergeHistory(dendrogram.getMergeHistory())
            .maxClusterSizeMb(maxClusterSizeMb)
            .iterations(iterationCount)
            .terminatedEarly(exhausted)
            .build();
    }

    private void validate(List<SmallFile> files, double maxClusterSizeMb) {
        if (!(maxClusterSizeMb > 0) || Double.isInfinite(maxClusterSizeMb)) {
            throw ClusteringValidationException.nonPositiveCapacity(maxClusterSizeMb);
        }
        if (files == null) {
            throw new ClusteringValidationException("files != null", "files", "Input file list is null");
        }
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i) == null) {
                throw ClusteringValidationException.nullFile(i);
            }
        }
    }

    private List<FileCluster> initializeClusters(List<SmallFile> files) {
        idSequence.reset();
        List<FileCluster> seeds = new ArrayList<>(files.size());
        for (SmallFile file : files) {
            seeds.add(FileCluster.seed(idSequence.next(), file));
        }
        return seeds;
    }

    /**
     * @return true if the loop stopped because no remaining pair fits under the ceiling
     */
    private boolean agglomerate(double maxClusterSizeMb) {
        while (distanceMatrix.size() > 1) {
            boolean merged = false;

            for (ClusterPair pair : distanceMatrix.getAllPairsSorted()) {
                FileCluster left = distanceMatrix.getCluster(pair.i());
                FileCluster right = distanceMatrix.getCluster(pair.j());

                if (left.canMergeWith(right, maxClusterSizeMb)) {
                    iterationCount++;
                    FileCluster child = distanceMatrix.mergeClusters(pair.i(), pair.j());
                    dendrogram.recordMerge(left.getClusterId(), right.getClusterId(),
                        child.getClusterId(), pair.distance());

                    log.debug("Iteration {}: cluster {} ({} MB) + cluster {} ({} MB) at distance {} -> cluster {} ({} MB, {} files), {} remaining",
                        iterationCount, left.getClusterId(), left.getTotalSize(),
                        right.getClusterId(), right.getTotalSize(), pair.distance(),
                        child.getClusterId(), child.getTotalSize(), child.size(), distanceMatrix.size());

                    merged = true;
                    break;
                }
            }

            if (!merged) {
                log.info("No further merge possible under {} MB; stopping with {} clusters",
                    maxClusterSizeMb, distanceMatrix.size());
                return true;
            }
        }
        return false;
    }

    /**
     * Final clusters (empty until the run has terminated)
     */
    public List<FileCluster> getClusters() {
        return clusters;
    }

    public ClusteringStatistics getStatistics() {
        return ClusteringStatistics.of(clusters, iterationCount);
    }
}
