package com.dcruver.smallfiles.domain;

import lombok.Getter;

/**
 * Raised when clustering input violates a precondition.
 * Carries the violated precondition and the offending input element so callers
 * can report exactly what was rejected.
 */
@Getter
public class ClusteringValidationException extends IllegalArgumentException {

    private final String precondition;
    private final String element;

    public ClusteringValidationException(String precondition, String element, String message) {
        super(message);
        this.precondition = precondition;
        this.element = element;
    }

    public static ClusteringValidationException nonPositiveSize(String fileName, double sizeMb) {
        return new ClusteringValidationException("size > 0", fileName,
            String.format("File size must be positive and finite: %s has %s MB", fileName, sizeMb));
    }

    public static ClusteringValidationException nonPositiveCapacity(double capacityMb) {
        return new ClusteringValidationException("capacity > 0", "capacityCeiling",
            String.format("Capacity ceiling must be positive and finite: %s MB", capacityMb));
    }

    public static ClusteringValidationException nullFile(int index) {
        return new ClusteringValidationException("file != null", "files[" + index + "]",
            String.format("Input file at index %d is null", index));
    }
}
