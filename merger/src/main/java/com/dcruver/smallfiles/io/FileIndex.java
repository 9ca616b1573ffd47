package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Locates individual files inside merged containers.
 * Offsets follow the layout written by {@link FileMerger}.
 */
@Component
@Slf4j
public class FileIndex {

    private final Map<String, FileLocation> index = new LinkedHashMap<>();
    private final Map<Integer, List<String>> clusterFiles = new TreeMap<>();

    /**
     * Position of one file: container cluster id, byte offset and byte length
     */
    public record FileLocation(int clusterId, long offset, long length) {
    }

    public record IndexSummary(int totalFilesIndexed, int totalClusters, Map<Integer, Integer> filesPerCluster) {
    }

    public void buildIndex(List<FileCluster> clusters) {
        index.clear();
        clusterFiles.clear();

        for (FileCluster cluster : clusters) {
            long offset = 0;
            List<String> names = new ArrayList<>(cluster.size());

            for (SmallFile file : cluster.getFiles()) {
                long length = SimulatedContent.length(file);
                if (index.containsKey(file.getName())) {
                    log.warn("Duplicate file name {} in cluster {}; keeping first location",
                        file.getName(), cluster.getClusterId());
                } else {
                    index.put(file.getName(), new FileLocation(cluster.getClusterId(), offset, length));
                }
                names.add(file.getName());
                offset += length;
            }

            clusterFiles.put(cluster.getClusterId(), List.copyOf(names));
        }

        log.info("Index built: {} files in {} clusters", index.size(), clusterFiles.size());
    }

    public Optional<FileLocation> getFileLocation(String fileName) {
        return Optional.ofNullable(index.get(fileName));
    }

    /**
     * Read one file's bytes back out of its container
     *
     * @return the content, or empty if the file is not indexed or its container is missing
     */
    public Optional<byte[]> extractFile(String fileName, Path containerDir) throws IOException {
        FileLocation location = index.get(fileName);
        if (location == null) {
            log.warn("File {} not found in index", fileName);
            return Optional.empty();
        }

        Path container = containerDir.resolve(FileMerger.containerName(location.clusterId()));
        if (!Files.exists(container)) {
            log.warn("Container {} not found", container);
            return Optional.empty();
        }

        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(location.length()));
        try (FileChannel channel = FileChannel.open(container, StandardOpenOption.READ)) {
            channel.position(location.offset());
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new IOException(String.format("Container %s ended before %s was fully read",
                        container.getFileName(), fileName));
                }
            }
        }

        log.info("Extracted {} from cluster {} (offset {}, {} bytes)",
            fileName, location.clusterId(), location.offset(), location.length());
        return Optional.of(buffer.array());
    }

    public List<String> listFilesInCluster(int clusterId) {
        return clusterFiles.getOrDefault(clusterId, List.of());
    }

    public IndexSummary getSummary() {
        Map<Integer, Integer> perCluster = new TreeMap<>();
        clusterFiles.forEach((id, names) -> perCluster.put(id, names.size()));
        return new IndexSummary(index.size(), clusterFiles.size(), perCluster);
    }

    /**
     * Table of every indexed file grouped by cluster
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        clusterFiles.forEach((clusterId, names) -> {
            sb.append(String.format("Cluster %d (%d files):\n", clusterId, names.size()));
            for (String name : names) {
                FileLocation location = index.get(name);
                if (location != null && location.clusterId() == clusterId) {
                    sb.append(String.format("  - %-30s | Offset: %10d bytes | Size: %10d bytes\n",
                        name, location.offset(), location.length()));
                }
            }
        });
        return sb.toString();
    }
}
