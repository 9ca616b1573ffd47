package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.config.MergerProperties;
import com.dcruver.smallfiles.domain.SmallFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Produces lists of small files with synthetic sizes for clustering runs.
 */
@Component
@Slf4j
public class FileGenerator {

    private final double minSizeMb;
    private final double maxSizeMb;
    private final Random random;

    @Autowired
    public FileGenerator(MergerProperties properties) {
        this(properties.getGenerator().getMinSizeMb(),
            properties.getGenerator().getMaxSizeMb(),
            properties.getGenerator().getSeed());
    }

    public FileGenerator(double minSizeMb, double maxSizeMb, Long seed) {
        if (!(minSizeMb > 0) || maxSizeMb < minSizeMb) {
            throw new IllegalArgumentException(String.format(
                "Invalid size range [%s, %s] MB", minSizeMb, maxSizeMb));
        }
        this.minSizeMb = minSizeMb;
        this.maxSizeMb = maxSizeMb;
        this.random = seed != null ? new Random(seed) : new Random();
    }

    /**
     * Canned size distributions
     */
    public enum Scenario {
        MIXED(Map.of(5.0, 15, 10.0, 12, 20.0, 8, 35.0, 5, 45.0, 3)),
        SMALL(Map.of(2.0, 20, 5.0, 15, 8.0, 10, 12.0, 5)),
        MEDIUM(Map.of(15.0, 10, 20.0, 10, 25.0, 8, 30.0, 6)),
        LARGE(Map.of(30.0, 8, 40.0, 6, 50.0, 4));

        private final Map<Double, Integer> distribution;

        Scenario(Map<Double, Integer> distribution) {
            // Ascending size order keeps generated names stable
            Map<Double, Integer> ordered = new LinkedHashMap<>();
            distribution.keySet().stream().sorted().forEach(size -> ordered.put(size, distribution.get(size)));
            this.distribution = ordered;
        }

        public Map<Double, Integer> getDistribution() {
            return distribution;
        }

        /**
         * Case-insensitive lookup; unknown names fall back to {@link #MIXED}
         */
        public static Scenario fromName(String name) {
            if (name != null) {
                for (Scenario scenario : values()) {
                    if (scenario.name().equalsIgnoreCase(name.trim())) {
                        return scenario;
                    }
                }
            }
            return MIXED;
        }
    }

    /**
     * Generate files with uniformly random sizes rounded to two decimals
     */
    public List<SmallFile> generate(int numFiles, String prefix) {
        List<SmallFile> files = new ArrayList<>(numFiles);

        for (int i = 1; i <= numFiles; i++) {
            double size = minSizeMb + random.nextDouble() * (maxSizeMb - minSizeMb);
            size = Math.max(0.01, Math.round(size * 100.0) / 100.0);
            files.add(new SmallFile(String.format(Locale.ROOT, "%s_%04d.dat", prefix, i), size));
        }

        log.info("Generated {} files between {} and {} MB (total {} MB)",
            numFiles, minSizeMb, maxSizeMb, String.format(Locale.ROOT, "%.2f", totalSize(files)));
        return files;
    }

    /**
     * Generate files from a size -> count distribution, in map iteration order
     */
    public List<SmallFile> generateWithDistribution(Map<Double, Integer> distribution) {
        List<SmallFile> files = new ArrayList<>();
        int counter = 1;

        for (Map.Entry<Double, Integer> entry : distribution.entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                files.add(new SmallFile(String.format(Locale.ROOT, "file_%04d.dat", counter++), entry.getKey()));
            }
        }

        log.info("Generated {} files from distribution {} (total {} MB)",
            files.size(), distribution, String.format(Locale.ROOT, "%.2f", totalSize(files)));
        return files;
    }

    public List<SmallFile> generateScenario(Scenario scenario) {
        return generateWithDistribution(scenario.getDistribution());
    }

    /**
     * First {@code maxDisplay} files, one per line, followed by a remainder count
     */
    public static String describe(List<SmallFile> files, int maxDisplay) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Sample of files (showing %d of %d):\n", Math.min(maxDisplay, files.size()), files.size()));
        for (int i = 0; i < Math.min(maxDisplay, files.size()); i++) {
            sb.append(String.format("  %d. %s\n", i + 1, files.get(i)));
        }
        if (files.size() > maxDisplay) {
            sb.append(String.format("  ... and %d more files\n", files.size() - maxDisplay));
        }
        return sb.toString();
    }

    private static double totalSize(List<SmallFile> files) {
        return files.stream().mapToDouble(SmallFile::getSizeMb).sum();
    }
}
