package imagematch.hashing;

import org.apache.commons.logging.*;

import javax.imageio.*;
import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;

public class ImageIoDecoder implements ImageDecoder {
    private static final Log log = LogFactory.getLog(ImageIoDecoder.class);

    @Override
    public Optional<BufferedImage> decode(Path file) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return Optional.ofNullable(ImageIO.read(in));
        } catch (IOException e) {
            log.debug("Unable to read image " + file + ": " + e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            // some ImageIO readers fail on truncated data with unchecked exceptions
            log.debug("Unable to decode image " + file + ": " + e);
            return Optional.empty();
        }
    }
}
