package imagematch.processors;

import imagematch.exceptions.*;
import imagematch.models.*;
import imagematch.sinks.*;
import imagematch.utils.*;
import org.apache.commons.logging.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Incremental cross-folder duplicate detection.
 * <p>
 * Each accepted file is compared with every file accepted before it that lives in a different
 * directory. When a pair reaches the similarity threshold it is reported and its two directories
 * are gated: no later pair drawn from those two directories is compared, let alone reported.
 * At most one result is therefore emitted per unordered directory pair.
 * <p>
 * Not thread-safe. A single consumer owns the processed files and the gate.
 */
public class DuplicateComparator {
    private static final Log log = LogFactory.getLog(DuplicateComparator.class);

    private final double threshold;
    private final ResultSink sink;
    private final RunStats stats;

    // processed files grouped by directory, in arrival order
    private final Map<Path, Map<Path, Fingerprint>> processed = new LinkedHashMap<>();
    private final Set<FolderPair> reportedFolders = new HashSet<>();

    public DuplicateComparator(double threshold, ResultSink sink, RunStats stats) {
        Similarity.validateThreshold(threshold);
        this.threshold = threshold;
        this.sink  = Objects.requireNonNull(sink, "sink");
        this.stats = stats != null ? stats : new RunStats();
    }

    public void accept(Path path, Fingerprint fingerprint) throws IOException {
        Path file = path.toAbsolutePath().normalize();
        Path dir = directoryOf(file);

        for (Map.Entry<Path, Map<Path, Fingerprint>> folder : processed.entrySet()) {
            Path otherDir = folder.getKey();
            if (otherDir.equals(dir)) continue;

            FolderPair pair = FolderPair.of(dir, otherDir);
            Map<Path, Fingerprint> others = folder.getValue();
            if (reportedFolders.contains(pair)) {
                stats.addGated(others.size());
                continue;
            }
            int remaining = others.size();
            for (Map.Entry<Path, Fingerprint> other : others.entrySet()) {
                remaining--;
                if (compare(other.getKey(), other.getValue(), file, fingerprint, pair)) {
                    stats.addGated(remaining);
                    break;
                }
            }
        }

        processed.computeIfAbsent(dir, d -> new LinkedHashMap<>()).put(file, fingerprint);
    }

    public boolean isReported(Path dirA, Path dirB) {
        return reportedFolders.contains(FolderPair.of(
                dirA.toAbsolutePath().normalize(), dirB.toAbsolutePath().normalize()));
    }

    public int processedCount() {
        return processed.values().stream().mapToInt(Map::size).sum();
    }

    // true when the pair was reported and the folder pair is now gated
    private boolean compare(Path oldFile, Fingerprint oldHash, Path newFile, Fingerprint newHash, FolderPair pair)
            throws IOException {
        int distance;
        try {
            distance = newHash.distanceTo(oldHash);
        } catch (IncompatibleFingerprintException e) {
            log.warn("Skipping comparison of " + oldFile + " and " + newFile + ": " + e.getMessage());
            return false;
        }
        stats.incrementCompared();

        double similarity = Similarity.percent(distance, newHash.bitLength());
        if (similarity >= threshold) {
            reportedFolders.add(pair);
            stats.incrementReported();
            sink.accept(new ComparisonResult(oldFile, newFile, distance, similarity));
            return true;
        }
        return false;
    }

    private static Path directoryOf(Path file) {
        Path parent = file.getParent();
        return parent != null ? parent : file.getRoot();
    }
}
