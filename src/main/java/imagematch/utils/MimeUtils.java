package imagematch.utils;

import org.apache.tika.*;

import java.io.*;
import java.nio.file.*;

public class MimeUtils {
    public static final String FALLBACK_MIME_TYPE = "application/octet-stream";

    private MimeUtils() {}

    // extract the major mime type from a mime string
    public static String getMajorType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return "";
        int slash = mimeType.indexOf('/');
        return slash > 0 ? mimeType.substring(0, slash) : mimeType;
    }

    public static boolean isImage(String mimeType) {
        return "image".equalsIgnoreCase(getMajorType(mimeType));
    }

    // Detects by file name and leading bytes, dropping any parameters such as charset.
    public static String detect(Tika tika, Path file) throws IOException {
        String full = tika.detect(file);
        return full != null ? full.split(";")[0].trim() : FALLBACK_MIME_TYPE;
    }
}
