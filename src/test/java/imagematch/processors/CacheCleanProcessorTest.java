package imagematch.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import imagematch.cache.HashCache;
import imagematch.cache.HashCacheStore;
import imagematch.models.FileIdentity;
import imagematch.models.Fingerprint;
import imagematch.testdata.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CacheCleanProcessorTest {

    @TempDir
    public Path tempFolder;

    private HashCacheStore store;
    private FileIdentity kept;
    private FileIdentity deleted;
    private FileIdentity changed;

    @BeforeEach
    public void createCache() throws IOException {
        Path a = TestImages.writeBlocks(tempFolder.resolve("a.png"), 1);
        Path b = TestImages.writeBlocks(tempFolder.resolve("b.png"), 2);
        Path c = TestImages.writeBlocks(tempFolder.resolve("c.png"), 3);
        kept = FileIdentity.of(a);
        deleted = FileIdentity.of(b);
        changed = FileIdentity.of(c);
        Files.delete(b);
        Files.writeString(c, "rewritten");

        Fingerprint fp = Fingerprint.of("phash", new boolean[64]);
        store = new HashCacheStore(tempFolder.resolve("cache.tsv"));
        store.save(new HashCache(Map.of(kept, fp, deleted, fp, changed, fp)));
    }

    /**
     * Stale entries are reported with a reason
     */
    @Test
    public void staleReason_detectsChanges() {
        assertNull(CacheCleanProcessor.staleReason(kept));
        assertEquals("file missing", CacheCleanProcessor.staleReason(deleted));
        assertTrue(CacheCleanProcessor.staleReason(changed).startsWith("size mismatch"));
    }

    /**
     * A dry run leaves the cache untouched
     */
    @Test
    public void run_dryRun() throws IOException {
        new CacheCleanProcessor(List.of(store.file().toFile()), true, false).run();
        assertEquals(3, store.load().size());
    }

    /**
     * A real run keeps only live entries and writes a backup
     */
    @Test
    public void run_prunes() throws IOException {
        new CacheCleanProcessor(List.of(store.file().toFile()), false, true).run();

        HashCache cleaned = store.load();
        assertEquals(1, cleaned.size());
        assertTrue(cleaned.contains(kept));
        try (Stream<Path> files = Files.list(tempFolder)) {
            assertEquals(1, files.filter(p -> p.toString().endsWith(".bak")).count());
        }
    }

    /**
     * Summaries read the same files without changing them
     */
    @Test
    public void summary_readsCache() {
        File file = store.file().toFile();
        assertEquals(0, new CacheSummaryProcessor(List.of(file)).run());
        assertEquals(2, new CacheSummaryProcessor(List.of(tempFolder.resolve("missing.tsv").toFile())).run());
        assertEquals(3, store.load().size());
    }
}
