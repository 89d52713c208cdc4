package imagematch.processors;

import imagematch.models.*;

import java.util.concurrent.*;

// Periodically redraws a single console line with hashing progress, rate and ETA.
class ProgressReporter implements AutoCloseable {
    private static final long   PROGRESS_INTERVAL_MS = 1_000;
    private static final double MS_PER_SECOND        = 1_000.0;
    private static final long   SHUTDOWN_WAIT_MS     = 500;

    private static final String ANSI_CARRIAGE_RETURN = "\r";
    private static final String ANSI_ERASE_LINE      = "\u001B[2K";
    private static final String PROGRESS_FORMAT      = "%s: %,d/%,d (%.1f%%) at %.2f f/s, ETA %s";

    private final String label;
    private final RunStats stats;
    private final int total;
    private final long startTime;
    private ScheduledExecutorService executor;

    ProgressReporter(String label, RunStats stats, int total) {
        this.label = label;
        this.stats = stats;
        this.total = total;
        this.startTime = System.currentTimeMillis();
    }

    void start() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-reporter");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::render, 0, PROGRESS_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    private void render() {
        long elapsed = System.currentTimeMillis() - startTime;
        int p = stats.processed();
        double rate = elapsed > 0 ? p * MS_PER_SECOND / elapsed : 0;
        double pct  = total > 0 ? 100.0 * p / total : 100.0;
        long etaMs  = rate > 0 ? (long) ((total - p) * MS_PER_SECOND / rate) : 0;
        String line = String.format(PROGRESS_FORMAT, label, p, total, pct, rate, formatHMS(etaMs));
        System.out.print(ANSI_CARRIAGE_RETURN + ANSI_ERASE_LINE + line);
        System.out.flush();
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdownNow();
        try {
            executor.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        render();
        System.out.println();
    }

    boolean isStopped() {
        return executor == null || executor.isTerminated();
    }

    static String formatHMS(long ms) {
        long s = ms / 1000;
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }
}
