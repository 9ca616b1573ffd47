package com.dcruver.smallfiles.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

/**
 * A small file waiting to be packed into a merged container.
 * Immutable; the size is validated once at construction.
 */
@Getter
@EqualsAndHashCode
public final class SmallFile {

    private final String name;
    private final double sizeMb;

    public SmallFile(String name, double sizeMb) {
        if (name == null) {
            throw new ClusteringValidationException("name != null", "name", "File name must not be null");
        }
        if (!(sizeMb > 0) || Double.isInfinite(sizeMb)) {
            throw ClusteringValidationException.nonPositiveSize(name, sizeMb);
        }
        this.name = name;
        this.sizeMb = sizeMb;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.2f MB)", name, sizeMb);
    }
}
