package com.dcruver.smallfiles.domain.dendrogram;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the merge tree. Leaves stand for a whole cluster; internal nodes
 * record a merge of their two children at {@link #getMergeDistance()}.
 */
@Getter
public class MergeNode {

    private final int clusterId;
    private final List<SmallFile> files;
    private final MergeNode left;
    private final MergeNode right;
    private final double mergeDistance;
    private final double totalSize;

    private MergeNode(int clusterId, List<SmallFile> files, MergeNode left, MergeNode right, double mergeDistance) {
        this.clusterId = clusterId;
        this.files = List.copyOf(files);
        this.left = left;
        this.right = right;
        this.mergeDistance = mergeDistance;
        this.totalSize = files.stream().mapToDouble(SmallFile::getSizeMb).sum();
    }

    public static MergeNode leaf(FileCluster cluster) {
        return new MergeNode(cluster.getClusterId(), cluster.getFiles(), null, null, 0.0);
    }

    /**
     * Internal node joining this node (left) with {@code other} (right)
     */
    public MergeNode merge(MergeNode other, int newClusterId, double distance) {
        List<SmallFile> merged = new ArrayList<>(files.size() + other.files.size());
        merged.addAll(files);
        merged.addAll(other.files);
        return new MergeNode(newClusterId, merged, this, other, distance);
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public int getHeight() {
        if (isLeaf()) {
            return 1;
        }
        int leftHeight = left != null ? left.getHeight() : 0;
        int rightHeight = right != null ? right.getHeight() : 0;
        return 1 + Math.max(leftHeight, rightHeight);
    }

    /**
     * File names under this node, left subtree first
     */
    public List<String> getLeafNames() {
        if (isLeaf()) {
            return files.stream().map(SmallFile::getName).toList();
        }
        List<String> names = new ArrayList<>();
        if (left != null) {
            names.addAll(left.getLeafNames());
        }
        if (right != null) {
            names.addAll(right.getLeafNames());
        }
        return names;
    }

    public TreeDescriptor toDescriptor() {
        List<TreeDescriptor> children = new ArrayList<>(2);
        if (left != null) {
            children.add(left.toDescriptor());
        }
        if (right != null) {
            children.add(right.toDescriptor());
        }
        return new TreeDescriptor(clusterId, totalSize, mergeDistance, getHeight(), getLeafNames(), children);
    }
}
