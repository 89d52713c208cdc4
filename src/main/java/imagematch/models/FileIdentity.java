package imagematch.models;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.*;

// Cache key for a file: absolute normalized path plus size and modification time, so a
// rewritten file under a reused path is never served a stale fingerprint.
public record FileIdentity(
        Path path,
        long sizeBytes,
        long lastModifiedMillis
) {

    public FileIdentity {
        path = path.toAbsolutePath().normalize();
    }

    public static FileIdentity of(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return of(file, attrs);
    }

    public static FileIdentity of(Path file, BasicFileAttributes attrs) {
        return new FileIdentity(file, attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    public Path directory() {
        Path parent = path.getParent();
        return parent != null ? parent : path.getRoot();
    }
}
