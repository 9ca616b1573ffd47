package com.dcruver.smallfiles.domain.clustering;

import com.dcruver.smallfiles.domain.ClusterDescriptor;
import com.dcruver.smallfiles.domain.ClusteringValidationException;
import com.dcruver.smallfiles.domain.FileCluster;
import com.dcruver.smallfiles.domain.SmallFile;
import com.dcruver.smallfiles.io.FileGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of the greedy capacity-bounded agglomeration loop.
 */
class AgglomerativeClusteringTest {

    private static List<SmallFile> files(Object... nameSizePairs) {
        List<SmallFile> files = new ArrayList<>();
        for (int i = 0; i < nameSizePairs.length; i += 2) {
            files.add(new SmallFile((String) nameSizePairs[i], ((Number) nameSizePairs[i + 1]).doubleValue()));
        }
        return files;
    }

    @Test
    void testThreeFileTraceMergesClosestThenRescans() {
        ClusteringResult result = new AgglomerativeClustering()
            .fit(files("f1", 40, "f2", 10, "f3", 50), 100.0);

        // f1 + f3 at distance 10, then f2 + {f1, f3} at single-linkage distance 30
        assertEquals(List.of(
            new MergeRecord(1, 3, 4, 10.0),
            new MergeRecord(2, 4, 5, 30.0)), result.getMergeHistory());

        assertEquals(1, result.getClusterCount());
        FileCluster only = result.getClusters().get(0);
        assertEquals(5, only.getClusterId());
        assertEquals(List.of("f2", "f1", "f3"), only.getFileNames());
        assertEquals(100.0, only.getTotalSize());
        assertEquals(2, result.getIterations());
        assertFalse(result.isTerminatedEarly());
    }

    @Test
    void testCapacityBlocksEveryMerge() {
        ClusteringResult result = new AgglomerativeClustering()
            .fit(files("a", 60, "b", 60), 100.0);

        assertEquals(2, result.getClusterCount());
        assertEquals(1, result.getClusters().get(0).getClusterId());
        assertEquals(2, result.getClusters().get(1).getClusterId());
        assertTrue(result.getMergeHistory().isEmpty());
        assertTrue(result.isTerminatedEarly());
    }

    @Test
    void testClosestInfeasiblePairIsSkippedForNextFeasible() {
        // a-b is closest (1) but 121 > 100; a-c (55) fits
        ClusteringResult result = new AgglomerativeClustering()
            .fit(files("a", 60, "b", 61, "c", 5), 100.0);

        assertEquals(List.of(new MergeRecord(1, 3, 4, 55.0)), result.getMergeHistory());
        assertEquals(List.of(2, 4), result.getClusters().stream().map(FileCluster::getClusterId).toList());
        assertEquals(List.of("a", "c"), result.getClusters().get(1).getFileNames());
        assertTrue(result.isTerminatedEarly());
    }

    @Test
    void testEveryPairAboveCeilingReturnsSeeds() {
        List<SmallFile> input = files("a", 70, "b", 80, "c", 90);
        ClusteringResult result = new AgglomerativeClustering().fit(input, 100.0);

        assertEquals(List.of(
            new ClusterDescriptor(1, List.of("a"), 70.0),
            new ClusterDescriptor(2, List.of("b"), 80.0),
            new ClusterDescriptor(3, List.of("c"), 90.0)), result.getClusterDescriptors());
        assertTrue(result.getMergeHistory().isEmpty());
    }

    @Test
    void testEmptyInputIsNotAnError() {
        AgglomerativeClustering engine = new AgglomerativeClustering();
        ClusteringResult result = engine.fit(List.of(), 128.0);

        assertTrue(result.getClusters().isEmpty());
        assertTrue(result.getMergeHistory().isEmpty());
        assertEquals(EngineState.TERMINATED, engine.getState());
        assertEquals(0, engine.getStatistics().getNumClusters());
    }

    @Test
    void testSingleFileNeedsNoMerge() {
        ClusteringResult result = new AgglomerativeClustering().fit(files("solo", 200), 100.0);

        // A lone file above the ceiling stays as its own cluster
        assertEquals(1, result.getClusterCount());
        assertTrue(result.getMergeHistory().isEmpty());
        assertFalse(result.isTerminatedEarly());
    }

    @Test
    void testNonPositiveCapacityIsRejectedBeforeAnyWork() {
        AgglomerativeClustering engine = new AgglomerativeClustering();

        ClusteringValidationException e = assertThrows(ClusteringValidationException.class,
            () -> engine.fit(files("a", 1), 0.0));
        assertEquals("capacity > 0", e.getPrecondition());

        assertThrows(ClusteringValidationException.class, () -> engine.fit(files("a", 1), -5.0));
        assertThrows(ClusteringValidationException.class, () -> engine.fit(files("a", 1), Double.NaN));

        assertEquals(EngineState.INITIALIZED, engine.getState());
        assertTrue(engine.getDendrogram().getMergeHistory().isEmpty());
    }

    @Test
    void testNullFileIsReportedWithItsIndex() {
        List<SmallFile> input = new ArrayList<>(files("a", 1));
        input.add(null);

        ClusteringValidationException e = assertThrows(ClusteringValidationException.class,
            () -> new AgglomerativeClustering().fit(input, 10.0));

        assertEquals("files[1]", e.getElement());
    }

    @Test
    void testEngineIsSingleUse() {
        AgglomerativeClustering engine = new AgglomerativeClustering();
        engine.fit(files("a", 1, "b", 2), 10.0);

        assertEquals(EngineState.TERMINATED, engine.getState());
        assertThrows(IllegalStateException.class, () -> engine.fit(files("a", 1), 10.0));
    }

    @Test
    void testDuplicateNamesStayDistinctSeeds() {
        ClusteringResult result = new AgglomerativeClustering().fit(files("x", 5, "x", 5), 100.0);

        assertEquals(1, result.getClusterCount());
        assertEquals(List.of("x", "x"), result.getClusters().get(0).getFileNames());
        assertEquals(new MergeRecord(1, 2, 3, 0.0), result.getMergeHistory().get(0));
    }

    @Test
    void testRepeatedRunsAreIdentical() {
        List<SmallFile> input = new FileGenerator(0.5, 50.0, 7L).generate(40, "file");

        ClusteringResult first = new AgglomerativeClustering().fit(input, 128.0);
        ClusteringResult second = new AgglomerativeClustering().fit(input, 128.0);

        assertEquals(first.getClusterDescriptors(), second.getClusterDescriptors());
        assertEquals(first.getMergeHistory(), second.getMergeHistory());
    }

    @Test
    void testConservationCapacityAndCountIdentity() {
        List<SmallFile> input = new FileGenerator(0.5, 50.0, 2024L).generate(60, "file");
        double ceiling = 128.0;

        ClusteringResult result = new AgglomerativeClustering().fit(input, ceiling);

        // Every input name appears exactly as often as it was given
        List<String> expected = new ArrayList<>(input.stream().map(SmallFile::getName).toList());
        List<String> actual = new ArrayList<>();
        result.getClusters().forEach(c -> actual.addAll(c.getFileNames()));
        Collections.sort(expected);
        Collections.sort(actual);
        assertEquals(expected, actual);

        for (FileCluster cluster : result.getClusters()) {
            assertTrue(cluster.getTotalSize() <= ceiling + 1e-9,
                "Cluster " + cluster.getClusterId() + " exceeds ceiling: " + cluster.getTotalSize());
        }

        assertEquals(input.size(), result.getClusterCount() + result.getMergeHistory().size());
        assertEquals(result.getMergeHistory().size(), result.getIterations());
    }

    @Test
    void testMergeIdsFollowSeedIds() {
        ClusteringResult result = new AgglomerativeClustering()
            .fit(files("a", 1, "b", 2, "c", 3, "d", 4), 100.0);

        int[] childIds = result.getMergeHistory().stream().mapToInt(MergeRecord::childId).toArray();
        assertArrayEquals(new int[] {5, 6, 7}, childIds);
        assertEquals(7, result.getClusters().get(0).getClusterId());
    }

    @Test
    void testMergeDistancesAreTheSortedMinimum() {
        ClusteringResult result = new AgglomerativeClustering()
            .fit(files("a", 1, "b", 2, "c", 4, "d", 8), 100.0);

        // Single linkage over 1-D sizes: each merge happens at the smallest remaining gap
        double[] distances = result.getMergeHistory().stream().mapToDouble(MergeRecord::distance).toArray();
        assertArrayEquals(new double[] {1.0, 2.0, 4.0}, distances);
        assertTrue(Arrays.stream(distances).allMatch(d -> d >= 0));
    }

    @Test
    void testStatisticsAfterRun() {
        AgglomerativeClustering engine = new AgglomerativeClustering();
        engine.fit(files("a", 60, "b", 30, "c", 60), 100.0);

        ClusteringStatistics stats = engine.getStatistics();

        // a + c are closest (0) but 120 > 100; a + b (30) fits, c stays alone
        assertEquals(2, stats.getNumClusters());
        assertEquals(3, stats.getTotalFiles());
        assertEquals(75.0, stats.getAvgClusterSizeMb(), 1e-9);
        assertEquals(60.0, stats.getMinClusterSizeMb(), 1e-9);
        assertEquals(90.0, stats.getMaxClusterSizeMb(), 1e-9);
        assertEquals(1.5, stats.getAvgFilesPerCluster(), 1e-9);
        assertEquals(1, stats.getIterations());
    }
}
