package imagematch.hashing;

import imagematch.models.*;
import org.apache.commons.logging.*;

import java.awt.image.*;
import java.util.*;

// Shared guard for hash computers: empty images and algorithm failures yield no fingerprint.
abstract class AbstractHashComputer implements HashComputer {
    private static final Log log = LogFactory.getLog(AbstractHashComputer.class);

    protected final int size;

    protected AbstractHashComputer(int size, int maxSize) {
        if (size <= 0 || size > maxSize) {
            throw new IllegalArgumentException(String.format(
                    "Hash size must be between 1 and %d for %s, got %d", maxSize, algorithm(), size));
        }
        this.size = size;
    }

    @Override
    public int bitLength() {
        return size * size;
    }

    @Override
    public final Optional<Fingerprint> compute(BufferedImage image) {
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(Fingerprint.of(algorithm(), computeBits(image)));
        } catch (RuntimeException e) {
            log.debug("Unable to compute " + label() + " fingerprint: " + e.getMessage(), e);
            return Optional.empty();
        }
    }

    protected abstract boolean[] computeBits(BufferedImage image);
}
