package imagematch.hashing;

import java.awt.image.*;
import java.nio.file.*;
import java.util.*;

// Reads a file into pixels. Empty when the file is unreadable or not a supported image.
public interface ImageDecoder {
    Optional<BufferedImage> decode(Path file);
}
