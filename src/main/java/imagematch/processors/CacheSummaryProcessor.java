package imagematch.processors;

import imagematch.*;
import imagematch.cache.*;
import imagematch.models.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

// Prints entry counts, duplicated fingerprints and folder spread for one or more cache files.
public class CacheSummaryProcessor implements Processor {

    private final List<File> cacheFiles;

    private int total = 0;
    private long totalSize = 0;
    private final Map<String, Integer> algorithmCounts = new TreeMap<>();
    private final Map<Fingerprint, Integer> fingerprintCounts = new HashMap<>();
    private final Set<Path> folders = new HashSet<>();

    public CacheSummaryProcessor(List<File> cacheFiles) {
        this.cacheFiles = cacheFiles;
    }

    @Override
    public int run() {
        int exitCode = ExitCode.OK;
        for (File file : cacheFiles) {
            if (!file.isFile()) {
                System.err.printf("ERROR: %s is not a valid file.%n", file);
                exitCode = ExitCode.INVALID_INPUT;
                continue;
            }
            HashCache cache = new HashCacheStore(file.toPath()).load();
            cache.entries().forEach(this::add);
        }
        printSummary();
        return exitCode;
    }

    private void add(FileIdentity identity, Fingerprint fingerprint) {
        total++;
        totalSize += identity.sizeBytes();
        algorithmCounts.merge(fingerprint.algorithm() + fingerprint.bitLength(), 1, Integer::sum);
        fingerprintCounts.merge(fingerprint, 1, Integer::sum);
        folders.add(identity.directory());
    }

    private void printSummary() {
        long duplicated = fingerprintCounts.values().stream().filter(n -> n > 1).mapToLong(n -> n).sum();
        System.out.println("Cache Summary:");
        System.out.printf("  Total entries          : %,d%n", total);
        System.out.printf("  Distinct fingerprints  : %,d%n", fingerprintCounts.size());
        if (total > 0) {
            System.out.printf("  Shared fingerprints    : %,d (%.1f%%)%n", duplicated, 100.0 * duplicated / total);
        }
        System.out.printf("  Folders                : %,d%n", folders.size());
        System.out.printf("  Total image size       : %.1f MB%n", totalSize / 1_000_000.0);
        System.out.println("  Algorithms:");
        algorithmCounts.forEach((k, v) ->
                System.out.printf("    %-20s : %,d %s%n", k, v, v == 1 ? "entry" : "entries"));
    }
}
