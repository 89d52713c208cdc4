package imagematch.commands;

import imagematch.hashing.*;
import imagematch.models.*;
import imagematch.processors.*;
import imagematch.utils.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

@Command(
        name = "dedup",
        description = "Find near-duplicate images in different folders of a tree and write one CSV row per matching folder pair.",
        mixinStandardHelpOptions = true
)
public class DedupCommand implements Callable<Integer> {
    public static final double DEFAULT_THRESHOLD = 96.0;

    @Parameters(index = "0",
            description = "Root directory to scan")
    private File rootDir;

    @Option(names = {"-t", "--threshold"},
            description = "Similarity percentage (0-100) at which two images are reported (default: ${DEFAULT-VALUE})")
    private double threshold = DEFAULT_THRESHOLD;

    @Option(names = {"-j", "--threads"},
            description = "Number of hashing threads, 0 for one per CPU (default: ${DEFAULT-VALUE})")
    private int threadCount = Runtime.getRuntime().availableProcessors();

    @Option(names = {"-o", "--output"},
            description = "CSV file receiving the results (default: ${DEFAULT-VALUE})")
    private File outputFile = new File("results.csv");

    @Option(names = {"-a", "--algorithm"},
            description = "Fingerprint algorithm: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private HashAlgorithm algorithm = HashAlgorithm.AHASH;

    @Option(names = {"--hash-size"},
            description = "Fingerprint side length N, giving N*N bits; at most 256 for ahash, 32 for phash (default: ${DEFAULT-VALUE})")
    private int hashSize = HashAlgorithm.DEFAULT_SIZE;

    @Option(names = {"-c", "--cache"},
            description = "Fingerprint cache file (default: .image_hashes-<algorithm><bits>.tsv in the root directory)")
    private File cacheFile;

    @Option(names = {"--no-cache"},
            description = "Do not read or write a fingerprint cache")
    private boolean noCache;

    @Option(names = {"-x", "--exclude"},
            description = "Skip directories whose path contains this text; repeatable (default: ${DEFAULT-VALUE})")
    private Set<String> excludedFolders = new LinkedHashSet<>(ImageFileScanner.DEFAULT_EXCLUDED_FOLDERS);

    @Option(names = {"-s", "--silent"},
            description = "Suppress console output")
    private boolean silent;

    @Override
    public Integer call() throws IOException {
        DedupSettings settings = new DedupSettings(
                rootDir.toPath(),
                threshold,
                threadCount,
                outputFile.toPath(),
                algorithm,
                hashSize,
                cacheFile != null ? cacheFile.toPath() : null,
                !noCache,
                excludedFolders,
                silent
        );
        return new DedupProcessor(settings).run();
    }

}
