package io.strata.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically reaps expired entries from registered {@link ManagedResource}s.
 *
 * <p>Stores already treat expired entries as absent on every read, so the
 * sweeper is optional. It bounds the memory held by entries nobody reads
 * again after they expire.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ExpirySweeper sweeper = ExpirySweeper.builder()
 *     .interval(Duration.ofSeconds(30))
 *     .build();
 *
 * sweeper.register(sessionStore);
 *
 * // On shutdown
 * sweeper.close();
 * }</pre>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class ExpirySweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final Map<String, ManagedResource> resources = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final long intervalMillis;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong sweepCount = new AtomicLong(0);

    private final ScheduledFuture<?> sweepTask;

    private ExpirySweeper(Builder builder) {
        this.intervalMillis = builder.interval.toMillis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "strata-expiry-sweeper");
            t.setDaemon(true);
            return t;
        });

        this.sweepTask = scheduler.scheduleAtFixedRate(
                this::periodicSweep,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS
        );
        log.info("[STRATA] ExpirySweeper started - interval={}ms", intervalMillis);
    }

    /**
     * Creates a new builder.
     * @return new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a resource for sweeping. A resource with the same name is replaced.
     * @param resource the resource to sweep
     */
    public void register(ManagedResource resource) {
        if (resource == null || resource.name() == null) {
            return;
        }
        resources.put(resource.name(), resource);
        log.debug("[STRATA] Resource registered: {}", resource.name());
    }

    /**
     * Deregisters a resource.
     * @param name the resource name
     * @return the removed resource, or null if not found
     */
    public ManagedResource deregister(String name) {
        ManagedResource removed = resources.remove(name);
        if (removed != null) {
            log.debug("[STRATA] Resource deregistered: {}", name);
        }
        return removed;
    }

    /**
     * Reaps expired entries from every registered resource now.
     * <p>A failing resource is logged and skipped.</p>
     * @return total entries released
     */
    public long sweep() {
        long released = 0;
        for (ManagedResource resource : resources.values()) {
            try {
                long count = resource.releaseExpired();
                released += count;
                if (count > 0) {
                    log.debug("[STRATA] Released {} expired items from {}", count, resource.name());
                }
            } catch (RuntimeException e) {
                log.warn("[STRATA] Error releasing expired from {}: {}", resource.name(), e.getMessage());
            }
        }
        sweepCount.incrementAndGet();
        if (released > 0) {
            totalReleased.addAndGet(released);
            log.info("[STRATA] Sweep released {} expired items", released);
        }
        return released;
    }

    /**
     * Returns metrics about this sweeper.
     * @return metrics snapshot
     */
    public Metrics getMetrics() {
        long items = resources.values().stream()
                .mapToLong(ManagedResource::itemCount)
                .sum();
        return new Metrics(resources.size(), items, totalReleased.get(), sweepCount.get());
    }

    /**
     * Returns a snapshot of all registered resources.
     * @return list of resource snapshots
     */
    public List<ResourceSnapshot> getResourceSnapshots() {
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        for (ManagedResource resource : resources.values()) {
            snapshots.add(new ResourceSnapshot(resource.name(), resource.itemCount()));
        }
        return snapshots;
    }

    /**
     * Returns true until {@link #close()} is called.
     * @return true if running
     */
    public boolean isRunning() {
        return running.get();
    }

    private void periodicSweep() {
        if (!running.get()) return;
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[STRATA] Error in periodic sweep", e);
        }
    }

    /**
     * Stops the sweeper. Registered resources keep their data.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            sweepTask.cancel(false);
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            resources.clear();
            log.info("[STRATA] ExpirySweeper stopped after {} sweeps", sweepCount.get());
        }
    }

    /**
     * Metrics snapshot.
     */
    public record Metrics(
            int resourceCount,
            long totalItems,
            long totalReleased,
            long sweeps
    ) {}

    /**
     * Resource snapshot for monitoring.
     */
    public record ResourceSnapshot(String name, long itemCount) {}

    /**
     * Builder for ExpirySweeper.
     */
    public static class Builder {
        private Duration interval = Duration.ofSeconds(60);

        /**
         * Sets the interval between sweeps.
         * @param interval sweep interval, must be positive
         * @return this builder
         */
        public Builder interval(Duration interval) {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("interval must be positive");
            }
            this.interval = interval;
            return this;
        }

        /**
         * Builds and starts the sweeper.
         * @return new ExpirySweeper instance
         */
        public ExpirySweeper build() {
            return new ExpirySweeper(this);
        }
    }
}
