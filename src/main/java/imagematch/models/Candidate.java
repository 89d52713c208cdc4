package imagematch.models;

import java.nio.file.*;

// A search candidate; fingerprint is null when none could be produced for the file.
public record Candidate(
        Path path,
        Fingerprint fingerprint
) {

    public boolean hasFingerprint() {
        return fingerprint != null;
    }
}
