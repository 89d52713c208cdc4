package imagematch.models;

import imagematch.hashing.*;

import java.nio.file.*;
import java.util.*;

// Run-scoped settings for a single-query search run.
public record SearchSettings(
        Path inputImage,
        Path searchFolder,
        double threshold,
        int concurrency,
        Path cacheFile,
        HashAlgorithm algorithm,
        int hashSize,
        Set<String> excludedFolders,
        boolean silent
) {
}
