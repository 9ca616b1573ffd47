package com.dcruver.smallfiles.domain.dendrogram;

import java.util.List;

/**
 * Serializable snapshot of a merge tree node, for export and visualization.
 */
public record TreeDescriptor(
    int clusterId,
    double totalSizeMb,
    double mergeDistance,
    int height,
    List<String> leafNames,
    List<TreeDescriptor> children
) {
}
