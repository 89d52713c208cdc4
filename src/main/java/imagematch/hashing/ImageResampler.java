package imagematch.hashing;

import java.awt.*;
import java.awt.image.*;

// Downscales an image into a grayscale luminance matrix, leaving the source untouched.
final class ImageResampler {
    private static final double RED_WEIGHT   = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT  = 0.114;

    private ImageResampler() {}

    static double[][] grayscale(BufferedImage source, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        int[] rgb = scaled.getRGB(0, 0, width, height, null, 0, width);
        double[][] gray = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int p = rgb[y * width + x];
                int r = (p >> 16) & 0xFF;
                int gr = (p >> 8) & 0xFF;
                int b = p & 0xFF;
                gray[y][x] = RED_WEIGHT * r + GREEN_WEIGHT * gr + BLUE_WEIGHT * b;
            }
        }
        return gray;
    }
}
