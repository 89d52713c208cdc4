package imagematch.models;

import java.nio.file.*;

// A reported near-duplicate pair from the de-duplication run.
public record ComparisonResult(
        Path pathA,
        Path pathB,
        int distance,
        double similarity
) {
}
