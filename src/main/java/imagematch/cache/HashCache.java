package imagematch.cache;

import imagematch.models.*;

import java.util.*;

/**
 * Mapping from file identity to fingerprint.
 * <p>
 * Entries are only ever added: {@link #merge(Map)} keeps an existing fingerprint when the same
 * identity is offered again, so each identity is computed at most once for the lifetime of the
 * cache. Not thread-safe; one owner at a time.
 */
public final class HashCache {
    private final Map<FileIdentity, Fingerprint> entries;

    public HashCache() {
        this.entries = new LinkedHashMap<>();
    }

    public HashCache(Map<FileIdentity, Fingerprint> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public boolean contains(FileIdentity identity) {
        return entries.containsKey(identity);
    }

    public Fingerprint get(FileIdentity identity) {
        return entries.get(identity);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<FileIdentity, Fingerprint> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Adds every identity not already present.
     *
     * @return number of entries added
     */
    public int merge(Map<FileIdentity, Fingerprint> newEntries) {
        int added = 0;
        for (Map.Entry<FileIdentity, Fingerprint> e : newEntries.entrySet()) {
            if (entries.putIfAbsent(e.getKey(), Objects.requireNonNull(e.getValue(), "fingerprint")) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashCache)) return false;
        return entries.equals(((HashCache) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "HashCache{" + entries.size() + " entries}";
    }
}
