package imagematch.models;

import java.util.concurrent.atomic.*;

// Counters for a single run. Hashing counters are updated from worker threads.
public final class RunStats {
    private final AtomicInteger discovered = new AtomicInteger();
    private final AtomicInteger cached = new AtomicInteger();
    private final AtomicInteger hashed = new AtomicInteger();
    private final AtomicInteger noHash = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicLong compared = new AtomicLong();
    private final AtomicLong gated = new AtomicLong();
    private final AtomicInteger reported = new AtomicInteger();

    public void addDiscovered(int n) { discovered.addAndGet(n); }
    public void addCached(int n)     { cached.addAndGet(n); }
    public void incrementHashed()    { hashed.incrementAndGet(); }
    public void incrementNoHash()    { noHash.incrementAndGet(); }
    public void incrementFailed()    { failed.incrementAndGet(); }
    public void incrementCompared()  { compared.incrementAndGet(); }
    public void addGated(long n)     { gated.addAndGet(n); }
    public void incrementReported()  { reported.incrementAndGet(); }

    public int discovered() { return discovered.get(); }
    public int cached()     { return cached.get(); }
    public int hashed()     { return hashed.get(); }
    public int noHash()     { return noHash.get(); }
    public int failed()     { return failed.get(); }
    public long compared()  { return compared.get(); }
    public long gated()     { return gated.get(); }
    public int reported()   { return reported.get(); }

    // Files whose hashing attempt has finished, successfully or not.
    public int processed() {
        return hashed.get() + noHash.get() + failed.get();
    }
}
