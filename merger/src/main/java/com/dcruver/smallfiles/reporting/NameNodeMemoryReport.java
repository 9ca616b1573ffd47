package com.dcruver.smallfiles.reporting;

import com.dcruver.smallfiles.config.MergerProperties;
import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Estimates NameNode metadata memory before and after merging.
 * Every namespace entry (an original file, or a merged container) costs a fixed
 * number of bytes, 150 by default.
 */
@Component
@Slf4j
public class NameNodeMemoryReport {

    public static final int DEFAULT_METADATA_BYTES = 150;

    private final int metadataBytesPerEntry;

    @Autowired
    public NameNodeMemoryReport(MergerProperties properties) {
        this(properties.getMetadataBytesPerEntry());
    }

    public NameNodeMemoryReport(int metadataBytesPerEntry) {
        if (metadataBytesPerEntry <= 0) {
            throw new IllegalArgumentException("Metadata bytes per entry must be positive: " + metadataBytesPerEntry);
        }
        this.metadataBytesPerEntry = metadataBytesPerEntry;
    }

    public long calculateOriginalMemory(List<SmallFile> files) {
        return (long) files.size() * metadataBytesPerEntry;
    }

    public long calculateMergedMemory(List<FileCluster> clusters) {
        return (long) clusters.size() * metadataBytesPerEntry;
    }

    public MemoryReduction calculateMemoryReduction(int originalFileCount, int clusterCount) {
        long original = (long) originalFileCount * metadataBytesPerEntry;
        long merged = (long) clusterCount * metadataBytesPerEntry;
        long saved = original - merged;
        double percentage = original > 0 ? Math.round(saved * 10000.0 / original) / 100.0 : 0.0;

        return MemoryReduction.builder()
            .originalFiles(originalFileCount)
            .mergedClusters(clusterCount)
            .originalMemoryBytes(original)
            .mergedMemoryBytes(merged)
            .memorySavedBytes(saved)
            .reductionPercentage(percentage)
            .metadataSizePerEntry(metadataBytesPerEntry)
            .build();
    }

    public String buildReport(List<SmallFile> files, List<FileCluster> clusters) {
        MemoryReduction stats = calculateMemoryReduction(files.size(), clusters.size());
        String rule = "=".repeat(70) + "\n";

        StringBuilder sb = new StringBuilder();
        sb.append(rule).append("NAMENODE MEMORY CONSUMPTION\n").append(rule);
        sb.append(String.format("Metadata per entry: %d bytes\n\n", metadataBytesPerEntry));

        sb.append("Original HDFS:\n");
        sb.append(String.format("  Files: %d\n", stats.getOriginalFiles()));
        sb.append(String.format("  Memory: %s\n", formatBytes(stats.getOriginalMemoryBytes())));
        sb.append(String.format("  Formula: %d files x %d bytes\n\n", stats.getOriginalFiles(), metadataBytesPerEntry));

        sb.append("After merging:\n");
        sb.append(String.format("  Clusters: %d\n", stats.getMergedClusters()));
        sb.append(String.format("  Memory: %s\n", formatBytes(stats.getMergedMemoryBytes())));
        sb.append(String.format("  Formula: %d clusters x %d bytes\n\n", stats.getMergedClusters(), metadataBytesPerEntry));

        sb.append("Reduction:\n");
        sb.append(String.format("  Saved: %s\n", formatBytes(stats.getMemorySavedBytes())));
        sb.append(String.format(Locale.ROOT, "  Percentage: %.2f%%\n", stats.getReductionPercentage()));
        sb.append(rule);
        return sb.toString();
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " bytes";
        } else if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
    }

    @Value
    @Builder
    public static class MemoryReduction {
        int originalFiles;
        int mergedClusters;
        long originalMemoryBytes;
        long mergedMemoryBytes;
        long memorySavedBytes;
        double reductionPercentage;
        int metadataSizePerEntry;
    }
}
