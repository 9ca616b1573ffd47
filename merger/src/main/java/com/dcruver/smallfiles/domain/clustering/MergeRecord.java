package com.dcruver.smallfiles.domain.clustering;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One accepted merge: two parent cluster ids, the child id and the
 * single-linkage distance at the time of the merge.
 */
public record MergeRecord(
    @JsonProperty("parent_a_id") int parentAId,
    @JsonProperty("parent_b_id") int parentBId,
    @JsonProperty("child_id") int childId,
    @JsonProperty("distance") double distance) {
}
