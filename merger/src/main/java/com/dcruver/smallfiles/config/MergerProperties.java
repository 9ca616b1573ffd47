package com.dcruver.smallfiles.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for clustering, container output and test-file generation.
 */
@Component
@ConfigurationProperties(prefix = "merger")
@Data
public class MergerProperties {
    private double maxClusterSizeMb = 128.0;
    private String outputDir = "output";
    private int metadataBytesPerEntry = 150;

    private Generator generator = new Generator();

    @Data
    public static class Generator {
        private double minSizeMb = 0.5;
        private double maxSizeMb = 50.0;
        private Long seed;
    }
}
