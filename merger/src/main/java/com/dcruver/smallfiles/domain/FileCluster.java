package com.dcruver.smallfiles.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A cluster of one or more small files that will share a merged container.
 *
 * Clusters are never mutated: a merge produces a new cluster holding the left
 * parent's files followed by the right parent's files, under a fresh id.
 */
@Getter
@EqualsAndHashCode
public final class FileCluster {

    private final int clusterId;
    private final List<SmallFile> files;
    private final double totalSize;

    private FileCluster(int clusterId, List<SmallFile> files) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A cluster must contain at least one file");
        }
        this.clusterId = clusterId;
        this.files = List.copyOf(files);
        this.totalSize = files.stream().mapToDouble(SmallFile::getSizeMb).sum();
    }

    /**
     * Seed cluster holding exactly one file
     */
    public static FileCluster seed(int clusterId, SmallFile file) {
        return new FileCluster(clusterId, List.of(file));
    }

    /**
     * Union of two clusters; this cluster's files come first.
     */
    public FileCluster mergeWith(FileCluster other, int newClusterId) {
        List<SmallFile> merged = new ArrayList<>(files.size() + other.files.size());
        merged.addAll(files);
        merged.addAll(other.files);
        return new FileCluster(newClusterId, merged);
    }

    /**
     * Whether merging with {@code other} keeps the aggregate size within the ceiling
     */
    public boolean canMergeWith(FileCluster other, double maxSizeMb) {
        return totalSize + other.totalSize <= maxSizeMb;
    }

    public int size() {
        return files.size();
    }

    public List<String> getFileNames() {
        return files.stream().map(SmallFile::getName).toList();
    }

    public ClusterDescriptor toDescriptor() {
        return new ClusterDescriptor(clusterId, getFileNames(), totalSize);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "FileCluster(id=%d, files=%d, size=%.2f MB)",
            clusterId, files.size(), totalSize);
    }
}
