package com.dcruver.smallfiles.domain.dendrogram;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DendrogramStatistics {
    int totalTrees;
    int totalMerges;
    int maxHeight;
    int totalLeaves;
}
