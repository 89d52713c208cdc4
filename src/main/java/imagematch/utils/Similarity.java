package imagematch.utils;

import imagematch.exceptions.*;

// Conversions between similarity percentages and Hamming distances.
public final class Similarity {
    public static final double MIN_THRESHOLD = 0.0;
    public static final double MAX_THRESHOLD = 100.0;

    private Similarity() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", Similarity.class.getName()));
    }

    public static void validateThreshold(double thresholdPercent) {
        if (Double.isNaN(thresholdPercent) || thresholdPercent < MIN_THRESHOLD || thresholdPercent > MAX_THRESHOLD) {
            throw new InvalidConfigurationException(String.format(
                    "Similarity threshold must be between %.0f and %.0f, got %s",
                    MIN_THRESHOLD, MAX_THRESHOLD, thresholdPercent));
        }
    }

    // Largest Hamming distance that can still satisfy the threshold; floor keeps it inclusive.
    public static int maxDistance(double thresholdPercent, int bitLength) {
        validateThreshold(thresholdPercent);
        return (int) Math.floor(bitLength * (1.0 - thresholdPercent / 100.0));
    }

    public static double percent(int distance, int bitLength) {
        if (bitLength <= 0) {
            throw new IllegalArgumentException("Bit length must be positive: " + bitLength);
        }
        int d = Math.max(0, Math.min(distance, bitLength));
        return ((double) (bitLength - d) / bitLength) * 100.0;
    }
}
