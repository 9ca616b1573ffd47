package com.dcruver.smallfiles.domain.clustering;

/**
 * Monotonic cluster id source owned by a single clustering run.
 * Ids start at 1 and are never reused within the run.
 */
public class ClusterIdSequence {

    private int last;

    public int next() {
        return ++last;
    }

    /**
     * Highest id handed out so far (0 before the first call)
     */
    public int current() {
        return last;
    }

    public void reset() {
        last = 0;
    }
}
