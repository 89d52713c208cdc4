package imagematch.models;

import imagematch.exceptions.*;

import java.util.*;

/**
 * Immutable fixed-length bit vector tagged with the algorithm that produced it.
 * Bit 0 is the most significant bit of the first word.
 */
public final class Fingerprint {
    private static final int WORD_BITS = Long.SIZE;
    private static final int HEX_CHARS_PER_WORD = WORD_BITS / 4;

    private final String algorithm;
    private final int bitLength;
    private final long[] words;

    private Fingerprint(String algorithm, int bitLength, long[] words) {
        this.algorithm = algorithm;
        this.bitLength = bitLength;
        this.words = words;
    }

    public static Fingerprint of(String algorithm, boolean[] bits) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (bits.length == 0) {
            throw new IllegalArgumentException("Fingerprint must have at least one bit");
        }
        long[] words = new long[wordCount(bits.length)];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i / WORD_BITS] |= 1L << (WORD_BITS - 1 - (i % WORD_BITS));
            }
        }
        return new Fingerprint(algorithm, bits.length, words);
    }

    public static Fingerprint fromHex(String algorithm, int bitLength, String hex) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (bitLength <= 0) {
            throw new IllegalArgumentException("Invalid bit length: " + bitLength);
        }
        int count = wordCount(bitLength);
        if (hex == null || hex.length() != count * HEX_CHARS_PER_WORD) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d hex characters for %d bits, got '%s'", count * HEX_CHARS_PER_WORD, bitLength, hex));
        }
        long[] words = new long[count];
        for (int i = 0; i < count; i++) {
            String chunk = hex.substring(i * HEX_CHARS_PER_WORD, (i + 1) * HEX_CHARS_PER_WORD);
            words[i] = Long.parseUnsignedLong(chunk, 16);
        }
        long tail = tailMask(bitLength);
        if ((words[count - 1] & ~tail) != 0) {
            throw new IllegalArgumentException("Hex value has bits set beyond length " + bitLength + ": " + hex);
        }
        return new Fingerprint(algorithm, bitLength, words);
    }

    public String algorithm() {
        return algorithm;
    }

    public int bitLength() {
        return bitLength;
    }

    public boolean bit(int index) {
        Objects.checkIndex(index, bitLength);
        return (words[index / WORD_BITS] & (1L << (WORD_BITS - 1 - (index % WORD_BITS)))) != 0;
    }

    public boolean isCompatibleWith(Fingerprint other) {
        return algorithm.equals(other.algorithm) && bitLength == other.bitLength;
    }

    // Hamming distance; only defined between fingerprints of the same algorithm and length.
    public int distanceTo(Fingerprint other) {
        if (!isCompatibleWith(other)) {
            throw new IncompatibleFingerprintException(String.format(
                    "Cannot compare %s/%d with %s/%d", algorithm, bitLength, other.algorithm, other.bitLength));
        }
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(words.length * HEX_CHARS_PER_WORD);
        for (long word : words) {
            String hex = Long.toHexString(word);
            sb.append("0".repeat(HEX_CHARS_PER_WORD - hex.length())).append(hex);
        }
        return sb.toString();
    }

    private static int wordCount(int bitLength) {
        return (bitLength + WORD_BITS - 1) / WORD_BITS;
    }

    private static long tailMask(int bitLength) {
        int used = bitLength % WORD_BITS;
        return used == 0 ? -1L : -1L << (WORD_BITS - used);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint that = (Fingerprint) o;
        return bitLength == that.bitLength && algorithm.equals(that.algorithm) && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(algorithm, bitLength) + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return algorithm + ":" + bitLength + ":" + toHex();
    }
}
