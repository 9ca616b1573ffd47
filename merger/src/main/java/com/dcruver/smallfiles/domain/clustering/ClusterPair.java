package com.dcruver.smallfiles.domain.clustering;

/**
 * Unordered pair of live matrix positions with their linkage distance.
 * Always normalized so that {@code i < j}.
 */
public record ClusterPair(int i, int j, double distance) {
}
