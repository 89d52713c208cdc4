package imagematch.processors;

import imagematch.*;
import imagematch.cache.*;
import imagematch.exceptions.*;
import imagematch.hashing.*;
import imagematch.models.*;
import imagematch.utils.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Searches a folder for the first image similar to an input image.
 * <p>
 * Fingerprints for the folder are loaded from the cache, the missing ones computed, and the
 * cache saved again before the search, so a later search over the same folder only hashes new
 * or changed files.
 */
public class FindSimilarProcessor implements Processor {

    private final SearchSettings settings;
    private final RunStats stats = new RunStats();
    private Match match;

    public FindSimilarProcessor(SearchSettings settings) {
        this.settings = settings;
    }

    public RunStats stats() {
        return stats;
    }

    // The match found by the last run, or null.
    public Match match() {
        return match;
    }

    @Override
    public int run() throws IOException {
        validate();
        HashComputer computer = DedupProcessor.createComputer(settings.algorithm(), settings.hashSize());
        FingerprintExtractor extractor = new FingerprintExtractor(new ImageIoDecoder(), computer);
        HashDispatcher dispatcher = new HashDispatcher(extractor, settings.concurrency(), stats);
        int maxDistance = Similarity.maxDistance(settings.threshold(), computer.bitLength());

        if (!settings.silent()) {
            System.out.printf("Similarity threshold: %.2f%% translates to max Hamming distance: %d (for hash size %d)%n",
                    settings.threshold(), maxDistance, computer.bitLength());
        }

        Path cacheFile = settings.cacheFile() != null
                ? settings.cacheFile()
                : HashCacheStore.defaultLocation(settings.searchFolder(), computer);
        HashCacheStore store = new HashCacheStore(cacheFile);
        HashCache cache = store.load(computer);

        if (!settings.silent()) System.out.printf("Scanning folder: %s%n", settings.searchFolder());
        List<Path> images = new ImageFileScanner(settings.excludedFolders(), Set.of(cacheFile))
                .scan(settings.searchFolder());
        List<FileIdentity> identities = DedupProcessor.identify(images);
        stats.addDiscovered(identities.size());
        if (!settings.silent()) System.out.printf("Found %d potential image files to check.%n", identities.size());

        if (identities.isEmpty()) {
            if (!settings.silent()) System.out.println("No potential image files found in the search folder.");
            return ExitCode.NO_MATCH;
        }

        int toCompute = HashDispatcher.missing(identities, cache).size();
        stats.addCached(identities.size() - toCompute);
        if (!settings.silent()) {
            System.out.printf(toCompute == 0
                    ? "All image hashes found in cache. No new calculations needed.%n"
                    : "Calculating hashes for %d new images using %d workers...%n", toCompute, dispatcher.concurrency());
        }

        ProgressReporter progress = new ProgressReporter("Hashing Images", stats, toCompute);
        if (!settings.silent() && toCompute > 0) progress.start();
        try (progress) {
            dispatcher.computeMissing(identities, cache);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while hashing images");
        }
        DedupProcessor.saveCache(store, cache);

        Fingerprint query = extractor.extract(settings.inputImage())
                .orElseThrow(() -> new InvalidConfigurationException(
                        "Could not process input image: " + settings.inputImage()));
        if (!settings.silent()) System.out.printf("%nInput image hash: %s%n", query.toHex());

        List<Candidate> candidates = new ArrayList<>(identities.size());
        for (FileIdentity id : identities) {
            candidates.add(new Candidate(id.path(), cache.get(id)));
        }

        match = new FirstMatchSearcher()
                .findFirstMatch(query, settings.inputImage(), candidates, settings.threshold())
                .orElse(null);

        if (match == null) {
            if (!settings.silent()) {
                System.out.printf("%nNo similar image found matching the threshold (>= %.2f%%)%n", settings.threshold());
                System.out.printf("Scanned %d candidate files.%n", candidates.size());
            }
            return ExitCode.NO_MATCH;
        }

        if (!settings.silent()) {
            System.out.println("\n--- Match Found! ---");
            System.out.printf("Input Image:      '%s'%n", match.queryPath());
            System.out.printf("Similar Image:    '%s'%n", match.matchPath());
            System.out.printf("Hamming Distance: %d (Threshold <= %d)%n", match.distance(), maxDistance);
            System.out.printf("Similarity:       %.2f%% (Threshold >= %.2f%%)%n", match.similarity(), settings.threshold());
            System.out.printf("Processed %d out of %d candidates before stopping.%n",
                    match.candidatesScanned(), candidates.size());
        }
        return ExitCode.OK;
    }

    private void validate() {
        Similarity.validateThreshold(settings.threshold());
        if (settings.inputImage() == null || !Files.isRegularFile(settings.inputImage())) {
            throw new InvalidConfigurationException("Input image not found or is a directory: " + settings.inputImage());
        }
        if (settings.searchFolder() == null || !Files.isDirectory(settings.searchFolder())) {
            throw new InvalidConfigurationException("Search folder not found or is not a directory: " + settings.searchFolder());
        }
    }
}
