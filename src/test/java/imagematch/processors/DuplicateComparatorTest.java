package imagematch.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import imagematch.exceptions.InvalidConfigurationException;
import imagematch.models.ComparisonResult;
import imagematch.models.Fingerprint;
import imagematch.models.FolderPair;
import imagematch.models.RunStats;
import imagematch.sinks.ResultSink;
import org.junit.jupiter.api.Test;

public class DuplicateComparatorTest {

    static class ListSink implements ResultSink {
        final List<ComparisonResult> results = new ArrayList<>();

        @Override
        public void accept(ComparisonResult result) {
            results.add(result);
        }

        @Override
        public void close() {
        }
    }

    static Fingerprint random(long seed) {
        Random random = new Random(seed);
        boolean[] bits = new boolean[64];
        for (int i = 0; i < bits.length; i++) bits[i] = random.nextBoolean();
        return Fingerprint.of("ahash", bits);
    }

    // copy of base with the first n bits flipped
    static Fingerprint flip(Fingerprint base, int n) {
        boolean[] bits = new boolean[base.bitLength()];
        for (int i = 0; i < bits.length; i++) bits[i] = base.bit(i) ^ (i < n);
        return Fingerprint.of(base.algorithm(), bits);
    }

    private static final Path X = Path.of("/photos/x");
    private static final Path Y = Path.of("/photos/y");
    private static final Path Z = Path.of("/photos/z");

    /**
     * One row for a matching folder pair, even when a second file in the folder also matches
     */
    @Test
    public void accept_gatesFolderPair() throws IOException {
        ListSink sink = new ListSink();
        RunStats stats = new RunStats();
        DuplicateComparator comparator = new DuplicateComparator(96, sink, stats);
        Fingerprint base = random(1);

        comparator.accept(X.resolve("x1.png"), base);
        comparator.accept(X.resolve("x2.png"), flip(base, 1));
        comparator.accept(Y.resolve("y1.png"), base);

        assertEquals(1, sink.results.size());
        ComparisonResult result = sink.results.get(0);
        assertEquals(X.resolve("x1.png"), result.pathA());
        assertEquals(Y.resolve("y1.png"), result.pathB());
        assertEquals(0, result.distance());
        assertEquals(100.0, result.similarity());
        assertTrue(comparator.isReported(Y, X));
        assertEquals(1, stats.compared());
        assertEquals(1, stats.gated());
    }

    /**
     * A later file in a gated folder is not even compared
     */
    @Test
    public void accept_gatedPairsSkipComparison() throws IOException {
        ListSink sink = new ListSink();
        RunStats stats = new RunStats();
        DuplicateComparator comparator = new DuplicateComparator(96, sink, stats);
        Fingerprint base = random(2);

        comparator.accept(X.resolve("x1.png"), base);
        comparator.accept(Y.resolve("y1.png"), base);
        comparator.accept(Y.resolve("y2.png"), base);
        comparator.accept(X.resolve("x3.png"), base);

        assertEquals(1, sink.results.size());
        assertEquals(1, stats.compared());
        assertEquals(3, stats.gated());
    }

    /**
     * A match stops the scan of that folder; the rest of it is counted as gated
     */
    @Test
    public void accept_matchStopsFolderScan() throws IOException {
        ListSink sink = new ListSink();
        RunStats stats = new RunStats();
        DuplicateComparator comparator = new DuplicateComparator(96, sink, stats);
        Fingerprint base = random(10);

        comparator.accept(X.resolve("x1.png"), random(11));
        comparator.accept(X.resolve("x2.png"), base);
        comparator.accept(X.resolve("x3.png"), base);
        comparator.accept(X.resolve("x4.png"), base);
        comparator.accept(Y.resolve("y1.png"), base);

        assertEquals(1, sink.results.size());
        assertEquals(X.resolve("x2.png"), sink.results.get(0).pathA());
        assertEquals(2, stats.compared());
        assertEquals(2, stats.gated());

        comparator.accept(Y.resolve("y2.png"), base);
        assertEquals(1, sink.results.size());
        assertEquals(2, stats.compared());
        assertEquals(6, stats.gated());
    }

    /**
     * Files in the same folder are never compared
     */
    @Test
    public void accept_sameFolderIgnored() throws IOException {
        ListSink sink = new ListSink();
        RunStats stats = new RunStats();
        DuplicateComparator comparator = new DuplicateComparator(96, sink, stats);
        Fingerprint base = random(3);

        comparator.accept(X.resolve("a.png"), base);
        comparator.accept(X.resolve("b.png"), base);

        assertTrue(sink.results.isEmpty());
        assertEquals(0, stats.compared());
        assertEquals(2, comparator.processedCount());
    }

    /**
     * Pairs below the threshold are compared but not reported, and do not gate the folders
     */
    @Test
    public void accept_belowThreshold() throws IOException {
        ListSink sink = new ListSink();
        DuplicateComparator comparator = new DuplicateComparator(96, sink, null);
        Fingerprint base = random(4);

        comparator.accept(X.resolve("a.png"), base);
        comparator.accept(Y.resolve("b.png"), flip(base, 3));
        assertTrue(sink.results.isEmpty());
        assertFalse(comparator.isReported(X, Y));

        comparator.accept(Y.resolve("c.png"), flip(base, 2));
        assertEquals(1, sink.results.size());
        assertEquals(96.875, sink.results.get(0).similarity());
    }

    /**
     * Fingerprints of another algorithm are skipped without stopping the run
     */
    @Test
    public void accept_incompatibleSkipped() throws IOException {
        ListSink sink = new ListSink();
        DuplicateComparator comparator = new DuplicateComparator(90, sink, null);
        Fingerprint base = random(5);

        comparator.accept(X.resolve("a.png"), Fingerprint.of("phash", new boolean[64]));
        comparator.accept(Z.resolve("b.png"), base);
        comparator.accept(Y.resolve("c.png"), base);

        assertEquals(1, sink.results.size());
        assertEquals(FolderPair.of(Y, Z), FolderPair.of(sink.results.get(0).pathA().getParent(),
                sink.results.get(0).pathB().getParent()));
    }

    /**
     * Whatever the arrival order, the set of reported folder pairs is the same and each appears once
     */
    @Test
    public void accept_orderIndependentFolderPairs() throws IOException {
        Fingerprint dupe = random(6);
        List<Map.Entry<Path, Fingerprint>> files = new ArrayList<>(List.of(
                Map.entry(X.resolve("1.png"), dupe),
                Map.entry(X.resolve("2.png"), dupe),
                Map.entry(Y.resolve("3.png"), flip(dupe, 1)),
                Map.entry(Y.resolve("4.png"), random(7)),
                Map.entry(Z.resolve("5.png"), random(8)),
                Map.entry(Z.resolve("6.png"), random(9)),
                Map.entry(Z.resolve("7.png"), dupe)));
        Set<FolderPair> expected = Set.of(FolderPair.of(X, Y), FolderPair.of(X, Z), FolderPair.of(Y, Z));

        Random shuffler = new Random(99);
        for (int round = 0; round < 25; round++) {
            Collections.shuffle(files, shuffler);
            ListSink sink = new ListSink();
            DuplicateComparator comparator = new DuplicateComparator(96, sink, null);
            for (Map.Entry<Path, Fingerprint> f : files) comparator.accept(f.getKey(), f.getValue());

            Set<FolderPair> reported = new HashSet<>();
            for (ComparisonResult r : sink.results) {
                assertTrue(reported.add(FolderPair.of(r.pathA().getParent(), r.pathB().getParent())));
            }
            assertEquals(expected, reported);
        }
    }

    /**
     * Thresholds outside [0,100] are rejected up front
     */
    @Test
    public void constructor_invalidThreshold() {
        assertThrows(InvalidConfigurationException.class, () -> new DuplicateComparator(120, new ListSink(), null));
    }
}
