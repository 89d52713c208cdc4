package imagematch.cache;

import imagematch.hashing.*;
import imagematch.models.*;
import org.apache.commons.logging.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.time.*;
import java.time.format.*;
import java.util.*;

/**
 * Reads and writes a {@link HashCache} as a tab separated file.
 * <p>
 * Each non-comment line holds {@code path, sizeBytes, lastModifiedMillis, algorithm, bitLength,
 * hexBits}. Lines starting with {@code #} are comments. A missing file loads as an empty cache;
 * an unreadable or malformed file is logged and also loads as an empty cache.
 */
public class HashCacheStore {
    private static final Log log = LogFactory.getLog(HashCacheStore.class);

    public static final String FORMAT_HEADER = "# imagematch fingerprint cache v1";
    public static final String COLUMNS_HEADER = "# path\tsize\tlastModifiedMillis\talgorithm\tbits\thex";
    public static final int EXPECTED_PROPERTIES = 6;
    public static final String DEFAULT_FILE_PREFIX = ".image_hashes-";
    public static final String DEFAULT_FILE_EXTENSION = ".tsv";

    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path file;

    public HashCacheStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    // Default cache location for a folder, named after the hash so algorithms never share a file.
    public static Path defaultLocation(Path folder, HashComputer computer) {
        return folder.resolve(DEFAULT_FILE_PREFIX + computer.label() + DEFAULT_FILE_EXTENSION);
    }

    public Path file() {
        return file;
    }

    public HashCache load() {
        if (!Files.exists(file)) {
            log.debug("Cache file " + file + " not found, starting fresh.");
            return new HashCache();
        }

        Map<FileIdentity, Fingerprint> entries = new LinkedHashMap<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) continue;
                FileIdentity identity = parseIdentity(line);
                entries.put(identity, parseFingerprint(line));
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read cache file " + file + ", starting fresh: " + e.getMessage());
            return new HashCache();
        } catch (IllegalArgumentException e) {
            log.warn(String.format("Cache file %s is corrupt at line %d, starting fresh: %s",
                    file, lineNumber, e.getMessage()));
            return new HashCache();
        }
        return new HashCache(entries);
    }

    // Loads only the fingerprints that computer could have produced; others are ignored.
    public HashCache load(HashComputer computer) {
        HashCache all = load();
        Map<FileIdentity, Fingerprint> usable = new LinkedHashMap<>();
        all.entries().forEach((identity, fingerprint) -> {
            if (computer.produced(fingerprint)) usable.put(identity, fingerprint);
        });
        int ignored = all.size() - usable.size();
        if (ignored > 0) {
            log.warn(String.format("Ignoring %d cached fingerprints not produced by %s in %s",
                    ignored, computer.label(), file));
        }
        return new HashCache(usable);
    }

    /**
     * Writes every entry, replacing any previous file. The data goes to a temporary sibling
     * first and is then moved over the target.
     */
    public void save(HashCache cache) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");

        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            writer.write(FORMAT_HEADER);
            writer.newLine();
            writer.write(COLUMNS_HEADER);
            writer.newLine();
            for (Map.Entry<FileIdentity, Fingerprint> e : cache.entries().entrySet()) {
                String path = e.getKey().path().toString();
                if (path.indexOf('\t') >= 0 || path.indexOf('\n') >= 0 || path.indexOf('\r') >= 0) {
                    log.warn("Not caching fingerprint for path containing control characters: " + path);
                    continue;
                }
                writer.write(toTsvString(e.getKey(), e.getValue()));
                writer.newLine();
            }
        }

        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // Copies the current file to a timestamped .bak sibling.
    public Path backup() throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException("Cannot backup missing cache file: " + file);
        }
        String backupName = file.getFileName() + "." + LocalDateTime.now().format(BACKUP_TIMESTAMP) + ".bak";
        return Files.copy(file, file.resolveSibling(backupName),
                StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
    }

    static String toTsvString(FileIdentity identity, Fingerprint fingerprint) {
        return String.join("\t",
                identity.path().toString(),
                String.valueOf(identity.sizeBytes()),
                String.valueOf(identity.lastModifiedMillis()),
                fingerprint.algorithm(),
                String.valueOf(fingerprint.bitLength()),
                fingerprint.toHex());
    }

    private static String[] split(String line) {
        String[] parts = line.split("\t", -1);
        if (parts.length != EXPECTED_PROPERTIES) {
            throw new IllegalArgumentException("Invalid TSV format: expected " + EXPECTED_PROPERTIES
                    + " fields, found " + parts.length);
        }
        return parts;
    }

    static FileIdentity parseIdentity(String line) {
        String[] parts = split(line);
        if (parts[0].isEmpty()) {
            throw new IllegalArgumentException("Empty path");
        }
        return new FileIdentity(Path.of(parts[0]), Long.parseLong(parts[1]), Long.parseLong(parts[2]));
    }

    static Fingerprint parseFingerprint(String line) {
        String[] parts = split(line);
        if (parts[3].isEmpty()) {
            throw new IllegalArgumentException("Empty algorithm tag");
        }
        return Fingerprint.fromHex(parts[3], Integer.parseInt(parts[4]), parts[5]);
    }
}
