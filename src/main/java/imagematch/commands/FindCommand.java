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
        name = "find",
        description = {
                "Search a folder for the first image similar to an input image.",
                "Candidates are checked in folder order and the search stops at the first one within the threshold;",
                "it is not guaranteed to be the closest image in the folder.",
                "Exit status: 0 match found, 1 no match, 2 invalid input, 3 I/O error."
        },
        mixinStandardHelpOptions = true
)
public class FindCommand implements Callable<Integer> {
    public static final double DEFAULT_THRESHOLD = 90.0;

    @Option(names = {"-i", "--input"}, required = true,
            description = "Image to look for")
    private File inputImage;

    @Option(names = {"-f", "--folder"}, required = true,
            description = "Folder to search")
    private File searchFolder;

    @Option(names = {"-t", "--threshold"},
            description = "Similarity percentage (0-100) a candidate must reach (default: ${DEFAULT-VALUE})")
    private double threshold = DEFAULT_THRESHOLD;

    @Option(names = {"-j", "--concurrency"},
            description = "Number of hashing workers, 0 for one per CPU (default: ${DEFAULT-VALUE})")
    private int concurrency = Runtime.getRuntime().availableProcessors();

    @Option(names = {"-c", "--cache"},
            description = "Fingerprint cache file (default: .image_hashes-<algorithm><bits>.tsv in the search folder)")
    private File cacheFile;

    @Option(names = {"-a", "--algorithm"},
            description = "Fingerprint algorithm: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private HashAlgorithm algorithm = HashAlgorithm.PHASH;

    @Option(names = {"--hash-size"},
            description = "Fingerprint side length N, giving N*N bits; at most 256 for ahash, 32 for phash (default: ${DEFAULT-VALUE})")
    private int hashSize = HashAlgorithm.DEFAULT_SIZE;

    @Option(names = {"-x", "--exclude"},
            description = "Skip directories whose path contains this text; repeatable (default: ${DEFAULT-VALUE})")
    private Set<String> excludedFolders = new LinkedHashSet<>(ImageFileScanner.DEFAULT_EXCLUDED_FOLDERS);

    @Option(names = {"-s", "--silent"},
            description = "Suppress console output")
    private boolean silent;

    @Override
    public Integer call() throws IOException {
        SearchSettings settings = new SearchSettings(
                inputImage.toPath(),
                searchFolder.toPath(),
                threshold,
                concurrency,
                cacheFile != null ? cacheFile.toPath() : null,
                algorithm,
                hashSize,
                excludedFolders,
                silent
        );
        return new FindSimilarProcessor(settings).run();
    }

}
