package imagematch.hashing;

import java.awt.image.*;

/**
 * Average hash: the image is reduced to an N x N grayscale thumbnail and each bit records
 * whether the corresponding pixel is brighter than the thumbnail's mean.
 */
public class AverageHashComputer extends AbstractHashComputer {
    public static final String TAG = "ahash";
    public static final int MAX_SIZE = 256;

    public AverageHashComputer(int size) {
        super(size, MAX_SIZE);
    }

    @Override
    public String algorithm() {
        return TAG;
    }

    @Override
    protected boolean[] computeBits(BufferedImage image) {
        double[][] gray = ImageResampler.grayscale(image, size, size);

        double sum = 0;
        for (double[] row : gray) {
            for (double p : row) sum += p;
        }
        double mean = sum / (size * size);

        boolean[] bits = new boolean[size * size];
        int idx = 0;
        for (double[] row : gray) {
            for (double p : row) {
                bits[idx++] = p > mean;
            }
        }
        return bits;
    }
}
