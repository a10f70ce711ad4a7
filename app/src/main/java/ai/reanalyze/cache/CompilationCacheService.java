package ai.reanalyze.cache;

import ai.reanalyze.graph.DependencyGraph;
import ai.reanalyze.util.ExecutorServiceUtil;
import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.CompiledUnit;
import ai.reanalyze.workspace.UnitCompiler;
import ai.reanalyze.workspace.UnitId;
import ai.reanalyze.workspace.WorkspaceSnapshot;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Compiled artifacts keyed by (session, unit).
 *
 * <p>Invalidation removes entries rather than recomputing them; a missing entry means "compile again on
 * next access". Operations are atomic per key only. A read racing an invalidation may return either the
 * old artifact or a miss, and both are fine because compilation is deterministic given unit content.
 *
 * <p>When an insert brings the cache to 80% of {@code maxEntries}, the least recently accessed fifth of
 * the entries is evicted.
 */
public class CompilationCacheService implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(CompilationCacheService.class);

    private static final double EVICTION_THRESHOLD = 0.8;
    private static final double EVICTION_FRACTION = 0.2;

    private record CacheKey(String sessionId, UnitId unitId) {}

    private static final class Entry {
        final CompiledUnit artifact;
        volatile Instant lastAccessedAt;

        Entry(CompiledUnit artifact, Instant now) {
            this.artifact = artifact;
            this.lastAccessedAt = now;
        }
    }

    /** Outcome of compiling a session's leaf units ahead of first use. */
    public record PrewarmResult(int compiled, List<UnitId> failed) {}

    private final ConcurrentMap<CacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final int maxEntries;
    private final Clock clock;

    @Nullable
    private ScheduledExecutorService maintenanceExecutor;

    public CompilationCacheService(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public CompilationCacheService(int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Optional<CompiledUnit> get(String sessionId, UnitId unitId) {
        var entry = entries.get(new CacheKey(sessionId, unitId));
        if (entry == null) {
            return Optional.empty();
        }
        entry.lastAccessedAt = clock.instant();
        return Optional.of(entry.artifact);
    }

    public void put(String sessionId, CompiledUnit artifact) {
        var key = new CacheKey(sessionId, artifact.unitId());
        entries.put(key, new Entry(artifact, clock.instant()));
        evictIfNeeded(key);
    }

    /**
     * Return the cached artifact if its content hash still matches the unit, otherwise compile and cache
     * a fresh one.
     */
    public CompiledUnit getOrCompile(String sessionId, CompilationUnit unit, UnitCompiler compiler)
            throws IOException {
        var hash = compiler.contentHash(unit);
        var cached = get(sessionId, unit.id());
        if (cached.isPresent() && cached.get().contentHash().equals(hash)) {
            logger.trace("Cache hit for {}/{}", sessionId, unit.id());
            return cached.get();
        }
        logger.debug("Cache {} for {}/{}; compiling", cached.isPresent() ? "stale" : "miss", sessionId, unit.id());
        var compiled = compiler.compile(unit);
        put(sessionId, compiled);
        return compiled;
    }

    /**
     * Remove the cached artifact for one unit. Removing an entry that is not there is a no-op.
     *
     * @return true if an entry was removed
     */
    public boolean invalidateUnit(String sessionId, UnitId unitId) {
        boolean removed = entries.remove(new CacheKey(sessionId, unitId)) != null;
        if (removed) {
            logger.debug("Invalidated cache entry {}/{}", sessionId, unitId);
        }
        return removed;
    }

    /** @return the number of entries removed */
    public int invalidateAll(String sessionId) {
        int removed = 0;
        for (var key : entries.keySet()) {
            if (key.sessionId().equals(sessionId) && entries.remove(key) != null) {
                removed++;
            }
        }
        logger.info("Invalidated {} cache entries for session {}", removed, sessionId);
        return removed;
    }

    /** Drop a session's entries when the session ends. */
    public int clearSession(String sessionId) {
        return invalidateAll(sessionId);
    }

    /** @return the number of entries removed */
    public int clear() {
        int removed = entries.size();
        entries.clear();
        logger.info("Cleared compilation cache ({} entries)", removed);
        return removed;
    }

    public CacheStats getStats() {
        var perSession = new TreeMap<String, Integer>();
        for (var key : entries.keySet()) {
            perSession.merge(key.sessionId(), 1, Integer::sum);
        }
        int total = perSession.values().stream().mapToInt(Integer::intValue).sum();
        return new CacheStats(total, perSession.size(), maxEntries, Map.copyOf(perSession));
    }

    /**
     * Compile the graph's leaf units so the first real request finds them warm. Failures are logged and
     * reported, never thrown.
     */
    public PrewarmResult prewarm(
            String sessionId, DependencyGraph graph, WorkspaceSnapshot snapshot, UnitCompiler compiler) {
        int compiled = 0;
        var failed = new ArrayList<UnitId>();
        for (var leaf : graph.getLeafUnits()) {
            var unit = snapshot.findUnit(leaf);
            if (unit.isEmpty()) {
                logger.warn("Leaf unit {} missing from snapshot of session {}", leaf, sessionId);
                failed.add(leaf);
                continue;
            }
            try {
                getOrCompile(sessionId, unit.get(), compiler);
                compiled++;
            } catch (IOException | RuntimeException e) {
                logger.warn("Prewarm of unit {} in session {} failed", leaf, sessionId, e);
                failed.add(leaf);
            }
        }
        logger.info("Prewarmed {} leaf units for session {} ({} failed)", compiled, sessionId, failed.size());
        return new PrewarmResult(compiled, List.copyOf(failed));
    }

    /**
     * Remove entries not accessed within {@code maxAge}.
     *
     * @return the number of entries removed
     */
    public int evictStale(Duration maxAge) {
        var cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (var e : entries.entrySet()) {
            if (e.getValue().lastAccessedAt.isBefore(cutoff) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Evicted {} stale cache entries (not accessed since {})", removed, cutoff);
        }
        return removed;
    }

    /** Periodically evict stale entries on a daemon thread until {@link #close()}. */
    public synchronized void startMaintenance(Duration interval, Duration staleAge) {
        if (maintenanceExecutor != null) {
            return;
        }
        maintenanceExecutor = ExecutorServiceUtil.newSingleThreadScheduler("CacheMaintenance");
        maintenanceExecutor.scheduleWithFixedDelay(
                () -> {
                    try {
                        evictStale(staleAge);
                    } catch (RuntimeException e) {
                        logger.error("Cache maintenance failed", e);
                    }
                },
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    /* The entry just inserted under {@code inserted} is never a victim. */
    private void evictIfNeeded(CacheKey inserted) {
        if (entries.size() < Math.ceil(maxEntries * EVICTION_THRESHOLD)) {
            return;
        }
        // one evictor at a time; concurrent inserts just skip
        if (!evictionLock.tryLock()) {
            return;
        }
        try {
            int size = entries.size();
            int toEvict = Math.max(1, (int) (size * EVICTION_FRACTION));
            var oldest = entries.entrySet().stream()
                    .filter(e -> !e.getKey().equals(inserted))
                    .sorted(Comparator.comparing(e -> e.getValue().lastAccessedAt))
                    .limit(toEvict)
                    .toList();
            int removed = 0;
            for (var e : oldest) {
                if (entries.remove(e.getKey(), e.getValue())) {
                    removed++;
                }
            }
            logger.info("Cache at {}/{} entries; evicted {} least recently used", size, maxEntries, removed);
        } finally {
            evictionLock.unlock();
        }
    }

    @Override
    public synchronized void close() {
        if (maintenanceExecutor != null) {
            ExecutorServiceUtil.shutdownQuietly(maintenanceExecutor, 1000);
            maintenanceExecutor = null;
        }
    }
}
