package imagematch.processors;

import imagematch.cache.*;
import imagematch.hashing.*;
import imagematch.models.*;
import org.apache.commons.logging.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

/**
 * Computes fingerprints for the identities a {@link HashCache} does not hold yet.
 * <p>
 * With a concurrency of one the batch runs on the calling thread in input order. Otherwise a
 * fixed pool of workers hashes files and hands results to a bounded queue that the calling
 * thread drains. A separate join task waits for every worker to finish before it closes the
 * queue, and only then are the new fingerprints merged into the cache, so the cache is never
 * touched while workers are still producing. Files without a fingerprint and per-file failures
 * are reported to the listener and left out of the merge.
 */
public class HashDispatcher {
    private static final Log log = LogFactory.getLog(HashDispatcher.class);

    public static final int DEFAULT_QUEUE_SIZE = 10_000;

    private static final HashResult POISON_PILL = new HashResult(null, null, null);

    private final FingerprintExtractor extractor;
    private final int concurrency;
    private final int queueSize;
    private final RunStats stats;

    public HashDispatcher(FingerprintExtractor extractor, int concurrency, RunStats stats) {
        this(extractor, concurrency, DEFAULT_QUEUE_SIZE, stats);
    }

    public HashDispatcher(FingerprintExtractor extractor, int concurrency, int queueSize, RunStats stats) {
        if (queueSize <= 0) {
            throw new IllegalArgumentException("Queue size must be positive: " + queueSize);
        }
        this.extractor   = Objects.requireNonNull(extractor, "extractor");
        this.concurrency = resolveConcurrency(concurrency);
        this.queueSize   = queueSize;
        this.stats       = stats != null ? stats : new RunStats();
    }

    // Unspecified or non-positive concurrency means one worker per logical CPU.
    public static int resolveConcurrency(int requested) {
        return requested > 0 ? requested : Runtime.getRuntime().availableProcessors();
    }

    public int concurrency() {
        return concurrency;
    }

    // Identities absent from the cache, de-duplicated, in input order.
    public static List<FileIdentity> missing(Collection<FileIdentity> identities, HashCache cache) {
        Set<FileIdentity> todo = new LinkedHashSet<>();
        for (FileIdentity id : identities) {
            if (!cache.contains(id)) todo.add(id);
        }
        return new ArrayList<>(todo);
    }

    public HashCache computeMissing(Collection<FileIdentity> identities, HashCache cache) throws InterruptedException {
        return computeMissing(identities, cache, result -> { });
    }

    /**
     * Hashes every identity missing from {@code cache} and merges the fingerprints into it.
     *
     * @param listener called on the calling thread once per result, as results arrive
     * @return the same cache instance, now holding the new fingerprints
     */
    public HashCache computeMissing(Collection<FileIdentity> identities,
                                    HashCache cache,
                                    Consumer<HashResult> listener) throws InterruptedException {
        List<FileIdentity> todo = missing(identities, cache);
        if (todo.isEmpty()) {
            log.debug("All fingerprints found in cache, nothing to compute.");
            return cache;
        }

        Map<FileIdentity, Fingerprint> computed = concurrency == 1
                ? runSequential(todo, listener)
                : runParallel(todo, listener);

        int added = cache.merge(computed);
        log.debug(String.format("Merged %d new fingerprints into cache (%d attempted).", added, todo.size()));
        return cache;
    }

    private Map<FileIdentity, Fingerprint> runSequential(List<FileIdentity> todo, Consumer<HashResult> listener) {
        Map<FileIdentity, Fingerprint> computed = new LinkedHashMap<>();
        for (FileIdentity id : todo) {
            collect(hash(id), computed, listener);
        }
        return computed;
    }

    private Map<FileIdentity, Fingerprint> runParallel(List<FileIdentity> todo, Consumer<HashResult> listener)
            throws InterruptedException {
        BlockingQueue<HashResult> queue = new LinkedBlockingQueue<>(queueSize);
        ExecutorService workers = Executors.newFixedThreadPool(Math.min(concurrency, todo.size()));
        ExecutorService joiner  = Executors.newSingleThreadExecutor();
        boolean completed = false;

        try {
            for (FileIdentity id : todo) {
                workers.submit(() -> {
                    try {
                        queue.put(hash(id));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            workers.shutdown();

            joiner.submit(() -> {
                try {
                    workers.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
                    queue.put(POISON_PILL);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            joiner.shutdown();

            Map<FileIdentity, Fingerprint> computed = new LinkedHashMap<>();
            while (true) {
                HashResult result = queue.take();
                if (result == POISON_PILL) break;
                collect(result, computed, listener);
            }
            joiner.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            completed = true;
            return computed;
        } finally {
            if (!completed) {
                workers.shutdownNow();
                joiner.shutdownNow();
            }
        }
    }

    private void collect(HashResult result, Map<FileIdentity, Fingerprint> computed, Consumer<HashResult> listener) {
        if (result.isFailed()) {
            log.warn("Error processing " + result.identity().path() + ": " + result.error());
        } else if (result.isHashed()) {
            computed.put(result.identity(), result.fingerprint());
        }
        listener.accept(result);
    }

    private HashResult hash(FileIdentity id) {
        try {
            Optional<Fingerprint> fingerprint = extractor.extract(id.path());
            if (fingerprint.isPresent()) {
                stats.incrementHashed();
                return HashResult.hashed(id, fingerprint.get());
            }
            stats.incrementNoHash();
            log.debug("No fingerprint for " + id.path());
            return HashResult.noHash(id);
        } catch (RuntimeException | Error e) {
            // an oversized image can exhaust the heap in the decoder; the batch goes on without it
            stats.incrementFailed();
            return HashResult.failed(id, e);
        }
    }
}
