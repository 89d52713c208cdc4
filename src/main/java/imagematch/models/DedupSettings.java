package imagematch.models;

import imagematch.hashing.*;

import java.nio.file.*;
import java.util.*;

// Run-scoped settings for a de-duplication run. A null cacheFile with useCache selects the default location.
public record DedupSettings(
        Path rootDir,
        double threshold,
        int threads,
        Path outputFile,
        HashAlgorithm algorithm,
        int hashSize,
        Path cacheFile,
        boolean useCache,
        Set<String> excludedFolders,
        boolean silent
) {
}
