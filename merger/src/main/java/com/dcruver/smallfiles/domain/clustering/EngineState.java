package com.dcruver.smallfiles.domain.clustering;

/**
 * Lifecycle of a single clustering run. Transitions only move forward.
 */
public enum EngineState {
    INITIALIZED,
    SEEDING,
    AGGLOMERATING,
    TERMINATED
}
