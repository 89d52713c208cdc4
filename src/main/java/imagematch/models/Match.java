package imagematch.models;

import java.nio.file.*;

// First candidate that satisfied the similarity threshold for a single-query search.
public record Match(
        Path queryPath,
        Path matchPath,
        int distance,
        double similarity,
        int candidatesScanned
) {
}
