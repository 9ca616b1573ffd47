package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.FileCluster;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Symmetric single-linkage distance table over the live clusters.
 *
 * The initial distance between two clusters is the absolute difference of their
 * total sizes. After a merge the row of the new cluster is folded from its parents'
 * rows with {@code min}; every other entry is carried over untouched.
 */
@Slf4j
public class DistanceMatrix {

    private final List<FileCluster> clusters;
    private final ClusterIdSequence idSequence;
    private double[][] matrix;

    public DistanceMatrix(List<FileCluster> clusters, ClusterIdSequence idSequence) {
        if (clusters.isEmpty()) {
            throw new IllegalArgumentException("Distance matrix needs at least one cluster");
        }
        this.clusters = new ArrayList<>(clusters);
        this.idSequence = idSequence;
        computeMatrix();
    }

    private void computeMatrix() {
        int n = clusters.size();
        matrix = new double[n][n];

        for (int i = 0; i < n; i++) {
            double sizeI = clusters.get(i).getTotalSize();
            for (int j = i + 1; j < n; j++) {
                double distance = Math.abs(sizeI - clusters.get(j).getTotalSize());
                matrix[i][j] = distance;
                matrix[j][i] = distance;
            }
        }
        log.debug("Computed {}x{} distance matrix", n, n);
    }

    /**
     * All live pairs {@code (i < j)} sorted ascending by distance.
     * The sort is stable, so equal distances keep row-major enumeration order.
     */
    public List<ClusterPair> getAllPairsSorted() {
        int n = clusters.size();
        List<ClusterPair> pairs = new ArrayList<>(n * (n - 1) / 2);

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                pairs.add(new ClusterPair(i, j, matrix[i][j]));
            }
        }

        pairs.sort(Comparator.comparingDouble(ClusterPair::distance));
        return pairs;
    }

    /**
     * The single closest pair, or {@code null} when fewer than two clusters are live.
     * Ties resolve to the first pair in row-major order.
     */
    public ClusterPair findClosestPair() {
        int n = clusters.size();
        if (n < 2) {
            return null;
        }

        ClusterPair best = null;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (best == null || matrix[i][j] < best.distance()) {
                    best = new ClusterPair(i, j, matrix[i][j]);
                }
            }
        }
        return best;
    }

    /**
     * Merge the clusters at positions {@code i} and {@code j}.
     *
     * The new cluster holds the lower position's files first and is appended at the end;
     * both parents are removed. Positions of the surviving clusters shift down accordingly.
     *
     * @return the newly created cluster
     */
    public FileCluster mergeClusters(int i, int j) {
        int n = clusters.size();
        if (i < 0 || i >= n || j < 0 || j >= n) {
            throw new IndexOutOfBoundsException(
                String.format("Merge indices (%d, %d) out of range for %d live clusters", i, j, n));
        }
        if (i == j) {
            throw new IllegalArgumentException("Cannot merge a cluster with itself: index " + i);
        }
        if (i > j) {
            int tmp = i;
            i = j;
            j = tmp;
        }

        FileCluster merged = clusters.get(i).mergeWith(clusters.get(j), idSequence.next());

        // Surviving positions in their current order
        int[] survivors = new int[n - 2];
        int s = 0;
        for (int k = 0; k < n; k++) {
            if (k != i && k != j) {
                survivors[s++] = k;
            }
        }

        int m = n - 1;
        double[][] next = new double[m][m];
        for (int row = 0; row < survivors.length; row++) {
            int oldRow = survivors[row];
            for (int col = row + 1; col < survivors.length; col++) {
                double d = matrix[oldRow][survivors[col]];
                next[row][col] = d;
                next[col][row] = d;
            }
            double linked = Math.min(matrix[i][oldRow], matrix[j][oldRow]);
            next[row][m - 1] = linked;
            next[m - 1][row] = linked;
        }

        clusters.remove(j);
        clusters.remove(i);
        clusters.add(merged);
        matrix = next;

        return merged;
    }

    public double getDistance(int i, int j) {
        return matrix[i][j];
    }

    public FileCluster getCluster(int index) {
        return clusters.get(index);
    }

    /**
     * Live clusters in matrix order
     */
    public List<FileCluster> getClusters() {
        return Collections.unmodifiableList(clusters);
    }

    public int size() {
        return clusters.size();
    }

    @Override
    public String toString() {
        return "DistanceMatrix(clusters=" + clusters.size() + ")";
    }
}
