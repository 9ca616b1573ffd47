package com.dcruver.smallfiles.domain.dendrogram;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.clustering.MergeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merge history and the forest built from it, one root per final cluster.
 *
 * Trees are built after clustering finishes. {@link #buildFromClusters(List)} makes every
 * final cluster a single leaf; {@link #buildFromHistory(List, List)} replays the recorded
 * merges over the seed clusters so each root carries its full binary history.
 */
@Slf4j
public class Dendrogram {

    private static final int MAX_LEAF_FILES_SHOWN = 3;

    private final List<MergeRecord> mergeHistory = new ArrayList<>();
    private List<MergeNode> roots = List.of();

    public void recordMerge(int clusterAId, int clusterBId, int newClusterId, double distance) {
        mergeHistory.add(new MergeRecord(clusterAId, clusterBId, newClusterId, distance));
    }

    /**
     * One leaf per final cluster, merge distance 0
     */
    public void buildFromClusters(List<FileCluster> finalClusters) {
        roots = finalClusters.stream().map(MergeNode::leaf).toList();
    }

    /**
     * Replay the merge history over the seed clusters and keep the subtrees
     * of the final clusters as roots.
     *
     * @throws IllegalStateException if the history refers to an unknown cluster id
     */
    public void buildFromHistory(List<FileCluster> seedClusters, List<FileCluster> finalClusters) {
        Map<Integer, MergeNode> nodes = new HashMap<>();
        for (FileCluster seed : seedClusters) {
            nodes.put(seed.getClusterId(), MergeNode.leaf(seed));
        }

        for (MergeRecord merge : mergeHistory) {
            MergeNode left = nodes.remove(merge.parentAId());
            MergeNode right = nodes.remove(merge.parentBId());
            if (left == null || right == null) {
                throw new IllegalStateException(String.format(
                    "Merge history refers to unknown cluster: %d + %d -> %d",
                    merge.parentAId(), merge.parentBId(), merge.childId()));
            }
            nodes.put(merge.childId(), left.merge(right, merge.childId(), merge.distance()));
        }

        List<MergeNode> built = new ArrayList<>(finalClusters.size());
        for (FileCluster cluster : finalClusters) {
            MergeNode root = nodes.get(cluster.getClusterId());
            if (root == null) {
                throw new IllegalStateException("No merge tree for final cluster " + cluster.getClusterId());
            }
            built.add(root);
        }
        roots = List.copyOf(built);
        log.debug("Built {} trees from {} recorded merges", roots.size(), mergeHistory.size());
    }

    public List<MergeNode> getRoots() {
        return roots;
    }

    public List<MergeRecord> getMergeHistory() {
        return Collections.unmodifiableList(mergeHistory);
    }

    public List<TreeDescriptor> toDescriptors() {
        return roots.stream().map(MergeNode::toDescriptor).toList();
    }

    /**
     * Text rendering of every tree in the forest
     */
    public String renderTree() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < roots.size(); i++) {
            MergeNode root = roots.get(i);
            sb.append(String.format("Tree %d (Cluster %d):\n", i + 1, root.getClusterId()));
            renderNode(root, "", true, sb);
            sb.append("\n");
        }
        return sb.toString();
    }

    private void renderNode(MergeNode node, String prefix, boolean isLast, StringBuilder sb) {
        String connector = isLast ? "└── " : "├── ";

        if (node.isLeaf()) {
            List<SmallFile> files = node.getFiles();
            StringBuilder names = new StringBuilder();
            for (int i = 0; i < Math.min(MAX_LEAF_FILES_SHOWN, files.size()); i++) {
                if (i > 0) {
                    names.append(", ");
                }
                names.append(files.get(i).getName());
            }
            if (files.size() > MAX_LEAF_FILES_SHOWN) {
                names.append("... (+").append(files.size() - MAX_LEAF_FILES_SHOWN).append(")");
            }
            sb.append(String.format(Locale.ROOT, "%s%sCluster %d (%.1fMB) [%s]\n",
                prefix, connector, node.getClusterId(), node.getTotalSize(), names));
            return;
        }

        sb.append(String.format(Locale.ROOT, "%s%sCluster %d (%.1fMB) [distance=%.1f]\n",
            prefix, connector, node.getClusterId(), node.getTotalSize(), node.getMergeDistance()));

        String childPrefix = prefix + (isLast ? "    " : "│   ");
        if (node.getLeft() != null) {
            renderNode(node.getLeft(), childPrefix, false, sb);
        }
        if (node.getRight() != null) {
            renderNode(node.getRight(), childPrefix, true, sb);
        }
    }

    public String renderMergeHistory() {
        if (mergeHistory.isEmpty()) {
            return "No merges recorded\n";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mergeHistory.size(); i++) {
            MergeRecord merge = mergeHistory.get(i);
            sb.append(String.format(Locale.ROOT, "Merge %d: Cluster %d + Cluster %d -> Cluster %d (distance: %.2f)\n",
                i + 1, merge.parentAId(), merge.parentBId(), merge.childId(), merge.distance()));
        }
        return sb.toString();
    }

    public DendrogramStatistics getStatistics() {
        if (roots.isEmpty()) {
            return DendrogramStatistics.builder().totalMerges(mergeHistory.size()).build();
        }
        return DendrogramStatistics.builder()
            .totalTrees(roots.size())
            .totalMerges(mergeHistory.size())
            .maxHeight(roots.stream().mapToInt(MergeNode::getHeight).max().orElse(0))
            .totalLeaves(roots.stream().mapToInt(r -> r.getLeafNames().size()).sum())
            .build();
    }
}
