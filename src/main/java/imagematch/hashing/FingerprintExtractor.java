package imagematch.hashing;

import imagematch.models.*;

import java.nio.file.*;
import java.util.*;

// Decodes a file and fingerprints it with the run's hash computer.
public class FingerprintExtractor {
    private final ImageDecoder decoder;
    private final HashComputer computer;

    public FingerprintExtractor(ImageDecoder decoder, HashComputer computer) {
        this.decoder  = Objects.requireNonNull(decoder, "decoder");
        this.computer = Objects.requireNonNull(computer, "computer");
    }

    public static FingerprintExtractor create(HashAlgorithm algorithm, int size) {
        return new FingerprintExtractor(new ImageIoDecoder(), algorithm.create(size));
    }

    public Optional<Fingerprint> extract(Path file) {
        return decoder.decode(file).flatMap(computer::compute);
    }
}
