package imagematch.hashing;

import java.awt.image.*;
import java.util.*;

/**
 * DCT based perceptual hash.
 * <p>
 * The image is reduced to a square grayscale thumbnail of side {@code N*N}, transformed with a
 * two dimensional DCT-II, and the top-left {@code N x N} block of low frequency coefficients is
 * kept. Each bit records whether its coefficient is above the block's median.
 * {@code N*N} must be a power of two.
 */
public class PerceptionHashComputer extends AbstractHashComputer {
    public static final String TAG = "phash";
    // side 32 already samples at 1024 x 1024
    public static final int MAX_SIZE = 32;

    private final int sampleSize;
    private final double[][] cosines;

    public PerceptionHashComputer(int size) {
        super(size, MAX_SIZE);
        int bits = size * size;
        if ((bits & (bits - 1)) != 0) {
            throw new IllegalArgumentException("Perceptual hash size squared must be a power of two: " + size);
        }
        this.sampleSize = bits;
        this.cosines = cosineTable(sampleSize);
    }

    @Override
    public String algorithm() {
        return TAG;
    }

    @Override
    protected boolean[] computeBits(BufferedImage image) {
        double[][] gray = ImageResampler.grayscale(image, sampleSize, sampleSize);
        double[][] dct = dct2d(gray);

        double[] lowFrequencies = new double[size * size];
        int idx = 0;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                lowFrequencies[idx++] = dct[y][x];
            }
        }

        double median = upperMedian(lowFrequencies);
        boolean[] bits = new boolean[lowFrequencies.length];
        for (int i = 0; i < lowFrequencies.length; i++) {
            bits[i] = lowFrequencies[i] > median;
        }
        return bits;
    }

    // Separable transform: rows first, then columns. Unnormalized; only relative values matter.
    private double[][] dct2d(double[][] pixels) {
        int n = sampleSize;
        double[][] rows = new double[n][];
        for (int y = 0; y < n; y++) {
            rows[y] = dct1d(pixels[y]);
        }
        double[][] out = new double[n][n];
        double[] column = new double[n];
        for (int x = 0; x < n; x++) {
            for (int y = 0; y < n; y++) column[y] = rows[y][x];
            double[] transformed = dct1d(column);
            for (int y = 0; y < n; y++) out[y][x] = transformed[y];
        }
        return out;
    }

    private double[] dct1d(double[] in) {
        int n = in.length;
        double[] out = new double[n];
        for (int k = 0; k < n; k++) {
            double sum = 0;
            double[] cos = cosines[k];
            for (int i = 0; i < n; i++) {
                sum += in[i] * cos[i];
            }
            out[k] = sum;
        }
        return out;
    }

    private static double[][] cosineTable(int n) {
        double[][] table = new double[n][n];
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                table[k][i] = Math.cos(Math.PI / n * (i + 0.5) * k);
            }
        }
        return table;
    }

    private static double upperMedian(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }
}
