package imagematch.utils;

import org.apache.commons.logging.*;
import org.apache.tika.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Finds image files beneath a root directory.
 * <p>
 * Directories are visited depth first from an explicit work stack, entries in lexical order,
 * so enumeration order is stable between runs and no task is spawned per directory. A
 * directory whose path contains any excluded fragment is skipped along with everything below
 * it. Files are kept when Tika detects an {@code image/*} type.
 */
public class ImageFileScanner {
    private static final Log log = LogFactory.getLog(ImageFileScanner.class);

    public static final Set<String> DEFAULT_EXCLUDED_FOLDERS = Set.of("$RECYCLE.BIN", ".Spotlight", ".fseventsd");

    private final Set<String> excludedFragments;
    private final Set<Path> ignoredFiles;
    private final Tika tika = new Tika();
    private int skippedCount;

    public ImageFileScanner(Set<String> excludedFragments, Set<Path> ignoredFiles) {
        this.excludedFragments = excludedFragments != null ? excludedFragments : Collections.emptySet();
        this.ignoredFiles = new HashSet<>();
        if (ignoredFiles != null) {
            for (Path p : ignoredFiles) this.ignoredFiles.add(p.toAbsolutePath().normalize());
        }
    }

    public List<Path> scan(Path root) throws IOException {
        Path start = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(start)) {
            throw new NotDirectoryException(start.toString());
        }

        List<Path> images = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(start);

        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            List<Path> entries;
            try {
                entries = listSorted(dir);
            } catch (IOException e) {
                if (dir.equals(start)) throw e;
                log.warn("Unable to list directory " + dir + ": " + e.getMessage());
                continue;
            }

            List<Path> subdirs = new ArrayList<>();
            for (Path entry : entries) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (isExcluded(entry)) {
                        log.debug("Skipping excluded directory " + entry);
                    } else {
                        subdirs.add(entry);
                    }
                } else if (Files.isRegularFile(entry) && !ignoredFiles.contains(entry) && isImage(entry)) {
                    images.add(entry);
                } else {
                    skippedCount++;
                }
            }
            for (int i = subdirs.size() - 1; i >= 0; i--) {
                pending.push(subdirs.get(i));
            }
        }
        return images;
    }

    // Number of non-image or ignored files seen by the last scans.
    public int skippedCount() {
        return skippedCount;
    }

    private boolean isExcluded(Path dir) {
        String s = dir.toString();
        for (String fragment : excludedFragments) {
            if (s.contains(fragment)) return true;
        }
        return false;
    }

    private boolean isImage(Path file) {
        try {
            return MimeUtils.isImage(MimeUtils.detect(tika, file));
        } catch (IOException e) {
            log.warn("Unable to detect MIME type for " + file + ": " + e.getMessage());
            return false;
        }
    }

    private static List<Path> listSorted(Path dir) throws IOException {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) entries.add(p);
        }
        entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return entries;
    }
}
