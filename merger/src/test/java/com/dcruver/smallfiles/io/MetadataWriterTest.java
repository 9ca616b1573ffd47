package com.dcruver.smallfiles.io;

import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.domain.clustering.ClusteringResult;
import com.dcruver.smallfiles.domain.clustering.FileClusteringService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataWriterTest {

    @TempDir
    Path tempDir;

    private MetadataWriter writer;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        writer = new MetadataWriter(tempDir.toString());
    }

    private static ClusteringResult clusterThreeFiles() {
        return new FileClusteringService().cluster(List.of(
            new SmallFile("f1", 10.0),
            new SmallFile("f2", 30.0),
            new SmallFile("f3", 20.0)), 40.0);
    }

    @Test
    void testClusterMetadataUsesSnakeCase() throws Exception {
        FileCluster cluster = FileCluster.seed(1, new SmallFile("a.dat", 1.234))
            .mergeWith(FileCluster.seed(2, new SmallFile("b.dat", 2.0)), 3);

        Path path = writer.writeClusterMetadata(cluster);

        assertEquals("cluster_3_metadata.json", path.getFileName().toString());
        JsonNode json = mapper.readTree(path.toFile());
        assertEquals(3, json.get("cluster_id").asInt());
        assertEquals(2, json.get("file_count").asInt());
        assertEquals(3.23, json.get("size_total_mb").asDouble());
        assertEquals("a.dat", json.get("files").get(0).asText());
    }

    @Test
    void testSummaryFileAndPerClusterFiles() throws Exception {
        ClusteringResult result = clusterThreeFiles();

        Path path = writer.writeAllMetadata(result.getClusters());

        JsonNode json = mapper.readTree(path.toFile());
        assertTrue(json.get("generated_at").isTextual());
        assertEquals(2, json.get("total_clusters").asInt());
        assertEquals(3, json.get("summary").get("total_files").asInt());
        assertEquals(33.33, json.get("summary").get("file_reduction_rate_percent").asDouble());
        for (FileCluster cluster : result.getClusters()) {
            assertTrue(Files.exists(tempDir.resolve("cluster_" + cluster.getClusterId() + "_metadata.json")));
        }
    }

    @Test
    void testMergeHistoryJson() throws Exception {
        ClusteringResult result = clusterThreeFiles();

        Path path = writer.writeMergeHistory(result.getMergeHistory());

        JsonNode json = mapper.readTree(path.toFile());
        assertEquals(1, json.size());
        JsonNode merge = json.get(0);
        assertEquals(1, merge.get("parent_a_id").asInt());
        assertEquals(3, merge.get("parent_b_id").asInt());
        assertEquals(4, merge.get("child_id").asInt());
        assertEquals(10.0, merge.get("distance").asDouble());
    }

    @Test
    void testBuildSummary() {
        List<FileCluster> clusters = List.of(
            FileCluster.seed(1, new SmallFile("a", 10.0)).mergeWith(FileCluster.seed(2, new SmallFile("b", 20.0)), 4),
            FileCluster.seed(3, new SmallFile("c", 5.0)));

        Map<String, Object> summary = writer.buildSummary(clusters);

        assertEquals(3, summary.get("total_files"));
        assertEquals(35.0, summary.get("total_size_mb"));
        assertEquals(17.5, summary.get("average_cluster_size_mb"));
        assertEquals(5.0, summary.get("min_cluster_size_mb"));
        assertEquals(30.0, summary.get("max_cluster_size_mb"));
        assertEquals(1, summary.get("min_files_per_cluster"));
        assertEquals(2, summary.get("max_files_per_cluster"));
        assertTrue(writer.buildSummary(List.of()).isEmpty());
    }

    @Test
    void testDetailedReportOrdersClustersAndMembers() throws Exception {
        ClusteringResult result = clusterThreeFiles();

        Path path = writer.writeDetailedReport(result, 3);

        String report = Files.readString(path);
        assertTrue(report.contains("SMALL FILE MERGE REPORT"));
        assertTrue(report.contains("Original files: 3"));
        assertTrue(report.indexOf("Cluster ID: 2") < report.indexOf("Cluster ID: 4"));
        assertTrue(report.indexOf("- f1 (") < report.indexOf("- f3 ("));
        assertTrue(report.endsWith("=\n"));
    }
}
