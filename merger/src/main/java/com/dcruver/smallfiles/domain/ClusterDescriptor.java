package com.dcruver.smallfiles.domain;

import java.util.List;

/**
 * Read-only view of a final cluster handed to output sinks:
 * member names in concatenation order plus the aggregate size.
 */
public record ClusterDescriptor(int clusterId, List<String> fileNames, double totalSizeMb) {

    public ClusterDescriptor {
        fileNames = List.copyOf(fileNames);
    }
}
