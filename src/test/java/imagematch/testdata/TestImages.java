package imagematch.testdata;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import javax.imageio.ImageIO;

/**
 * Generates deterministic test images: a 64x64 picture made of an 8x8 grid of flat gray cells
 * whose shades come from a seeded random generator. Equal seeds give pixel-identical images,
 * different seeds give fingerprints roughly half of whose bits differ.
 */
public final class TestImages {
    public static final int SIDE = 64;
    public static final int CELLS = 8;

    private TestImages() {}

    public static BufferedImage blocks(long seed) {
        Random random = new Random(seed);
        int cell = SIDE / CELLS;
        BufferedImage image = new BufferedImage(SIDE, SIDE, BufferedImage.TYPE_INT_RGB);
        for (int cy = 0; cy < CELLS; cy++) {
            for (int cx = 0; cx < CELLS; cx++) {
                int gray = random.nextInt(256);
                int rgb = (gray << 16) | (gray << 8) | gray;
                for (int y = cy * cell; y < (cy + 1) * cell; y++) {
                    for (int x = cx * cell; x < (cx + 1) * cell; x++) {
                        image.setRGB(x, y, rgb);
                    }
                }
            }
        }
        return image;
    }

    public static Path writePng(Path file, BufferedImage image) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG writer available");
        }
        return file;
    }

    public static Path writeBlocks(Path file, long seed) throws IOException {
        return writePng(file, blocks(seed));
    }
}
