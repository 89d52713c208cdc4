package imagematch.models;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

public class FolderPairTest {

    /**
     * The pair is unordered
     */
    @Test
    public void of_unordered() {
        Path a = Path.of("/photos/a");
        Path b = Path.of("/photos/b");
        assertEquals(FolderPair.of(a, b), FolderPair.of(b, a));
        assertEquals(a, FolderPair.of(b, a).first());
    }
}
