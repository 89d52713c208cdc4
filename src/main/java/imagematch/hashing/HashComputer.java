package imagematch.hashing;

import imagematch.models.*;

import java.awt.image.*;
import java.util.*;

/**
 * Turns decoded image content into a fixed-length perceptual fingerprint.
 * <p>
 * Implementations are deterministic and keep no state between calls: the same pixels always
 * produce the same fingerprint, and the input image is never modified or retained. An empty
 * result means no fingerprint could be produced; callers skip such files silently.
 */
public interface HashComputer {

    /** Tag stored with every fingerprint this computer produces, e.g. {@code phash}. */
    String algorithm();

    /** Number of bits in every fingerprint this computer produces. */
    int bitLength();

    Optional<Fingerprint> compute(BufferedImage image);

    /** True when {@code fingerprint} could have been produced by this computer. */
    default boolean produced(Fingerprint fingerprint) {
        return fingerprint.algorithm().equals(algorithm()) && fingerprint.bitLength() == bitLength();
    }

    /** Short label combining tag and length, e.g. {@code phash64}. */
    default String label() {
        return algorithm() + bitLength();
    }
}
