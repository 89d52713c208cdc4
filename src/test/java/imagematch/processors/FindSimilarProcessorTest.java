package imagematch.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import imagematch.ExitCode;
import imagematch.cache.HashCacheStore;
import imagematch.exceptions.InvalidConfigurationException;
import imagematch.hashing.HashAlgorithm;
import imagematch.hashing.PerceptionHashComputer;
import imagematch.models.SearchSettings;
import imagematch.testdata.TestImages;
import imagematch.utils.ImageFileScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FindSimilarProcessorTest {

    @TempDir
    public Path tempFolder;

    private Path folder;

    @BeforeEach
    public void createFolder() throws IOException {
        folder = tempFolder.resolve("library");
        TestImages.writeBlocks(folder.resolve("a.png"), 1);
        TestImages.writeBlocks(folder.resolve("b.png"), 2);
        TestImages.writeBlocks(folder.resolve("nested/c.png"), 3);
        Files.writeString(folder.resolve("readme.txt"), "hello");
    }

    private SearchSettings settings(Path input, double threshold) {
        return new SearchSettings(input, folder, threshold, 2, null, HashAlgorithm.PHASH, 8,
                ImageFileScanner.DEFAULT_EXCLUDED_FOLDERS, true);
    }

    /**
     * An identical copy outside the folder finds its twin
     */
    @Test
    public void run_findsMatch() throws IOException {
        Path input = TestImages.writeBlocks(tempFolder.resolve("query/copy.png"), 3);
        FindSimilarProcessor processor = new FindSimilarProcessor(settings(input, 90));

        assertEquals(ExitCode.OK, processor.run());
        assertEquals(folder.resolve("nested/c.png").toAbsolutePath(), processor.match().matchPath());
        assertEquals(0, processor.match().distance());
        assertTrue(Files.exists(HashCacheStore.defaultLocation(folder, new PerceptionHashComputer(8))));
    }

    /**
     * An unrelated image reports no match
     */
    @Test
    public void run_noMatch() throws IOException {
        Path input = TestImages.writeBlocks(tempFolder.resolve("query/other.png"), 99);
        FindSimilarProcessor processor = new FindSimilarProcessor(settings(input, 95));

        assertEquals(ExitCode.NO_MATCH, processor.run());
        assertNull(processor.match());
    }

    /**
     * A query inside the folder never matches itself
     */
    @Test
    public void run_selfExcluded() throws IOException {
        FindSimilarProcessor processor = new FindSimilarProcessor(settings(folder.resolve("b.png"), 100));
        assertEquals(ExitCode.NO_MATCH, processor.run());

        TestImages.writeBlocks(folder.resolve("nested/b-copy.png"), 2);
        FindSimilarProcessor again = new FindSimilarProcessor(settings(folder.resolve("b.png"), 100));
        assertEquals(ExitCode.OK, again.run());
        assertEquals(folder.resolve("nested/b-copy.png").toAbsolutePath(), again.match().matchPath());
        assertEquals(3, again.stats().cached());
        assertEquals(1, again.stats().hashed());
    }

    /**
     * Invalid thresholds, missing inputs and undecodable inputs are configuration errors
     */
    @Test
    public void run_invalidConfiguration() throws IOException {
        Path input = TestImages.writeBlocks(tempFolder.resolve("query/copy.png"), 3);
        assertThrows(InvalidConfigurationException.class, () -> new FindSimilarProcessor(settings(input, 100.1)).run());
        assertThrows(InvalidConfigurationException.class,
                () -> new FindSimilarProcessor(settings(tempFolder.resolve("missing.png"), 90)).run());
        assertThrows(InvalidConfigurationException.class,
                () -> new FindSimilarProcessor(settings(folder.resolve("readme.txt"), 90)).run());
    }
}
