package imagematch.models;

import java.nio.file.*;

/**
 * Unordered pair of directories. {@link #of(Path, Path)} orders the two members so that
 * {@code of(a, b).equals(of(b, a))}.
 */
public record FolderPair(Path first, Path second) {

    public static FolderPair of(Path a, Path b) {
        return a.compareTo(b) <= 0 ? new FolderPair(a, b) : new FolderPair(b, a);
    }
}
