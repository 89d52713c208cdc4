package imagematch.processors;

import imagematch.*;
import imagematch.cache.*;
import imagematch.models.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Removes cache entries whose file is gone or whose size or modification time no longer
 * matches the file on disk. Nothing is written in dry-run mode; otherwise the cache file is
 * backed up before it is rewritten.
 */
public class CacheCleanProcessor implements Processor {

    private final List<File> cacheFiles;
    private final boolean dryRun;
    private final boolean verbose;

    public CacheCleanProcessor(List<File> cacheFiles, boolean dryRun, boolean verbose) {
        this.cacheFiles = cacheFiles;
        this.dryRun     = dryRun;
        this.verbose    = verbose;
    }

    @Override
    public int run() throws IOException {
        int exitCode = ExitCode.OK;
        for (File cacheFile : cacheFiles) {
            if (!cacheFile.isFile()) {
                System.err.printf("ERROR: %s is not a valid file.%n", cacheFile);
                exitCode = ExitCode.INVALID_INPUT;
                continue;
            }
            HashCacheStore store = new HashCacheStore(cacheFile.toPath());
            HashCache cache = store.load();

            Map<FileIdentity, Fingerprint> kept = new LinkedHashMap<>();
            int removed = 0;
            for (Map.Entry<FileIdentity, Fingerprint> e : cache.entries().entrySet()) {
                String reason = staleReason(e.getKey());
                if (reason == null) {
                    kept.put(e.getKey(), e.getValue());
                    if (verbose) System.out.printf("KEEP   : %s%n", e.getKey().path());
                } else {
                    removed++;
                    if (verbose) System.out.printf("REMOVE : %s  reason=%s%n", e.getKey().path(), reason);
                }
            }

            System.out.printf("%n=== %s ===%n", cacheFile.getName());
            System.out.printf("Examined : %d entries%n", cache.size());
            System.out.printf("Kept     : %d entries%n", kept.size());
            System.out.printf("Removed  : %d entries%n", removed);

            if (dryRun) {
                System.out.println("Dry run; no changes written.");
            } else if (removed > 0) {
                Path backup = store.backup();
                System.out.printf("Backup   : %s%n", backup.getFileName());
                store.save(new HashCache(kept));
                System.out.printf("Written  : %d entries%n", kept.size());
            }
        }
        return exitCode;
    }

    // null when the entry still describes the file on disk
    static String staleReason(FileIdentity identity) {
        Path path = identity.path();
        if (!Files.isRegularFile(path)) {
            return "file missing";
        }
        try {
            FileIdentity actual = FileIdentity.of(path);
            if (actual.sizeBytes() != identity.sizeBytes()) {
                return String.format("size mismatch (cache=%d,disk=%d)", identity.sizeBytes(), actual.sizeBytes());
            }
            if (actual.lastModifiedMillis() != identity.lastModifiedMillis()) {
                return String.format("timestamp mismatch (cache=%d,disk=%d)",
                        identity.lastModifiedMillis(), actual.lastModifiedMillis());
            }
        } catch (IOException e) {
            return "I/O error: " + e.getMessage();
        }
        return null;
    }
}
