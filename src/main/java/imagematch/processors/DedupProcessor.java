package imagematch.processors;

import imagematch.*;
import imagematch.cache.*;
import imagematch.exceptions.*;
import imagematch.hashing.*;
import imagematch.models.*;
import imagematch.sinks.*;
import imagematch.utils.*;
import org.apache.commons.logging.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Finds near-duplicate images across the folders of a tree.
 * <p>
 * Cached fingerprints are fed to the {@link DuplicateComparator} first, in enumeration order;
 * fingerprints for the remaining files are streamed to it as the {@link HashDispatcher}
 * produces them. Every matching folder pair becomes one row in the output.
 */
public class DedupProcessor implements Processor {
    private static final Log log = LogFactory.getLog(DedupProcessor.class);

    private static final String STARTUP_FORMAT = "Scanning %s with %d threads, %s, threshold %.2f%%.%n";
    private static final String DONE_FORMAT    =
            "Done. elapsed %s, images %,d, cached %,d, hashed %,d, no hash %,d, failed %,d, compared %,d, reported %,d%n";

    private final DedupSettings settings;
    private final RunStats stats = new RunStats();

    public DedupProcessor(DedupSettings settings) {
        this.settings = settings;
    }

    public RunStats stats() {
        return stats;
    }

    @Override
    public int run() throws IOException {
        validate();
        HashComputer computer = createComputer(settings.algorithm(), settings.hashSize());
        FingerprintExtractor extractor = new FingerprintExtractor(new ImageIoDecoder(), computer);
        HashDispatcher dispatcher = new HashDispatcher(extractor, settings.threads(), stats);
        long startTime = System.currentTimeMillis();

        if (!settings.silent()) {
            System.out.printf(STARTUP_FORMAT, settings.rootDir(), dispatcher.concurrency(), computer.label(), settings.threshold());
            System.out.printf("Output file: %s%n", settings.outputFile());
        }

        HashCacheStore store = null;
        if (settings.useCache()) {
            store = new HashCacheStore(settings.cacheFile() != null
                    ? settings.cacheFile()
                    : HashCacheStore.defaultLocation(settings.rootDir(), computer));
        }

        Set<Path> ignored = new HashSet<>();
        ignored.add(settings.outputFile());
        if (store != null) ignored.add(store.file());
        List<Path> images = new ImageFileScanner(settings.excludedFolders(), ignored).scan(settings.rootDir());
        List<FileIdentity> identities = identify(images);
        stats.addDiscovered(identities.size());

        HashCache cache = store != null ? store.load(computer) : new HashCache();

        try (ResultSink sink = new ConsoleEchoSink(new CsvResultSink(settings.outputFile()), settings.silent())) {
            DuplicateComparator comparator = new DuplicateComparator(settings.threshold(), sink, stats);

            int cachedHits = 0;
            for (FileIdentity id : identities) {
                Fingerprint fingerprint = cache.get(id);
                if (fingerprint != null) {
                    comparator.accept(id.path(), fingerprint);
                    cachedHits++;
                }
            }
            stats.addCached(cachedHits);

            int toCompute = HashDispatcher.missing(identities, cache).size();
            ProgressReporter progress = new ProgressReporter("Hashing", stats, toCompute);
            if (!settings.silent() && toCompute > 0) progress.start();
            try (progress) {
                dispatcher.computeMissing(identities, cache, result -> {
                    if (!result.isHashed()) return;
                    try {
                        comparator.accept(result.identity().path(), result.fingerprint());
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            } catch (UncheckedIOException e) {
                throw e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while hashing images");
            }
        } finally {
            if (store != null) saveCache(store, cache);
        }

        if (!settings.silent()) {
            System.out.printf(DONE_FORMAT, ProgressReporter.formatHMS(System.currentTimeMillis() - startTime),
                    stats.discovered(), stats.cached(), stats.hashed(), stats.noHash(), stats.failed(),
                    stats.compared(), stats.reported());
        }
        return ExitCode.OK;
    }

    private void validate() {
        Similarity.validateThreshold(settings.threshold());
        if (settings.rootDir() == null || !Files.isDirectory(settings.rootDir())) {
            throw new InvalidConfigurationException(settings.rootDir() + " is not a directory.");
        }
        if (settings.outputFile() == null) {
            throw new InvalidConfigurationException("An output file is required.");
        }
        Path outputParent = settings.outputFile().toAbsolutePath().getParent();
        if (outputParent != null && !Files.isDirectory(outputParent)) {
            throw new InvalidConfigurationException("Output directory does not exist: " + outputParent);
        }
    }

    static HashComputer createComputer(HashAlgorithm algorithm, int size) {
        try {
            return algorithm.create(size);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage());
        }
    }

    static List<FileIdentity> identify(List<Path> files) {
        List<FileIdentity> identities = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                identities.add(FileIdentity.of(file));
            } catch (IOException e) {
                log.warn("Unable to read attributes of " + file + ": " + e.getMessage());
            }
        }
        return identities;
    }

    static void saveCache(HashCacheStore store, HashCache cache) {
        try {
            store.save(cache);
            log.debug(String.format("Saved %d fingerprints to cache %s", cache.size(), store.file()));
        } catch (IOException e) {
            log.warn("Could not save cache file " + store.file() + ": " + e.getMessage(), e);
            System.err.printf("WARN: Could not save cache file %s: %s%n", store.file(), e.getMessage());
        }
    }

    // Prints each reported pair to the console before handing it on.
    private static final class ConsoleEchoSink implements ResultSink {
        private final ResultSink delegate;
        private final boolean silent;

        ConsoleEchoSink(ResultSink delegate, boolean silent) {
            this.delegate = delegate;
            this.silent = silent;
        }

        @Override
        public void accept(ComparisonResult result) throws IOException {
            if (!silent) {
                System.out.printf("%nFound similar files:%n%s%n%s%nSimilarity: %.2f%%%n",
                        result.pathA(), result.pathB(), result.similarity());
            }
            delegate.accept(result);
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }
}
