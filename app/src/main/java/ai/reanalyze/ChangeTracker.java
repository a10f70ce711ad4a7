package ai.reanalyze;

import ai.reanalyze.exception.WatchSetupException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks which files change under a session's root while the session is paused.
 *
 * <p>Each watched session has its own channel. The watch service publishes one {@link ChangeBatch} per
 * coalesced burst onto it, and nothing else is shared with the watcher thread. Readers fold pending
 * messages into the session's change log (latest timestamp per path) before answering, so single-file
 * and multi-file batches end up in one deduplicated set. Delivery is at-least-once, which is harmless
 * since the log is keyed by path.
 */
public class ChangeTracker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ChangeTracker.class);

    private final WatchServiceFactory watchServiceFactory;
    private final Clock clock;
    private final ConcurrentMap<String, SessionWatch> watches = new ConcurrentHashMap<>();

    private static final class SessionWatch {
        final String sessionId;
        final Path root;
        final BlockingQueue<ChangeBatch> channel = new LinkedBlockingQueue<>();

        // guarded by this
        final Map<Path, Instant> changeLog = new HashMap<>();
        boolean overflowed;

        IWatchService service;

        SessionWatch(String sessionId, Path root) {
            this.sessionId = sessionId;
            this.root = root;
        }

        synchronized void record(ChangeBatch batch) {
            batch.changes().forEach((path, at) -> changeLog.merge(path, at, (a, b) -> a.isAfter(b) ? a : b));
            overflowed |= batch.overflowed();
        }

        synchronized void drain() {
            ChangeBatch batch;
            while ((batch = channel.poll()) != null) {
                record(batch);
            }
        }
    }

    public ChangeTracker(WatchServiceFactory watchServiceFactory) {
        this(watchServiceFactory, Clock.systemUTC());
    }

    public ChangeTracker(WatchServiceFactory watchServiceFactory, Clock clock) {
        this.watchServiceFactory = watchServiceFactory;
        this.clock = clock;
    }

    public void startWatching(String sessionId, Path rootPath, List<String> patterns) throws WatchSetupException {
        startWatching(sessionId, rootPath, patterns, () -> false);
    }

    /**
     * Start watching {@code rootPath} for the session, replacing any earlier watch of the same session.
     * The cancellation signal is checked before anything is registered and again once the watch is up;
     * a cancelled setup leaves the tracker exactly as it was.
     *
     * @throws WatchSetupException if the watch could not be started
     * @throws CancellationException if {@code cancelled} reports true
     */
    public void startWatching(String sessionId, Path rootPath, List<String> patterns, BooleanSupplier cancelled)
            throws WatchSetupException {
        checkCancelled(sessionId, cancelled);

        var root = rootPath.toAbsolutePath().normalize();
        var watch = new SessionWatch(sessionId, root);
        IWatchService service = null;
        try {
            service = watchServiceFactory.create(root, patterns, batch -> publish(watch, batch));
            service.start();
        } catch (IOException | RuntimeException e) {
            if (service != null) {
                service.close();
            }
            logger.warn("Could not start watching {} for session {}", root, sessionId, e);
            throw new WatchSetupException(root, e);
        }

        if (cancelled.getAsBoolean()) {
            service.close();
            logger.debug("Watch setup for session {} cancelled after start", sessionId);
            throw new CancellationException("Watch setup for session " + sessionId + " was cancelled");
        }

        watch.service = service;
        var previous = watches.put(sessionId, watch);
        if (previous != null) {
            logger.debug("Replacing existing watch of {} for session {}", previous.root, sessionId);
            previous.service.close();
        }
        logger.info("Watching {} for session {} ({} patterns)", root, sessionId, patterns.size());
    }

    private void publish(SessionWatch watch, IWatchService.EventBatch batch) {
        var message = new ChangeBatch(watch.sessionId, batch.files(), batch.isOverflowed());
        logger.debug("{} change for session {}: {} file(s){}",
                message.kind(), watch.sessionId, message.changes().size(), message.overflowed() ? " (overflowed)" : "");
        watch.channel.offer(message);
    }

    /**
     * Stop watching and forget the session's change log. Safe to call when the session is not watched.
     *
     * @return true if a watch was stopped
     */
    public boolean stopWatching(String sessionId) {
        var watch = watches.remove(sessionId);
        if (watch == null) {
            return false;
        }
        watch.service.close();
        watch.channel.clear();
        logger.info("Stopped watching {} for session {}", watch.root, sessionId);
        return true;
    }

    public boolean isWatching(String sessionId) {
        return watches.containsKey(sessionId);
    }

    public Set<String> watchedSessions() {
        return Set.copyOf(watches.keySet());
    }

    /** Push events still inside the quiescence window onto the session's channel. */
    public void flush(String sessionId) {
        var watch = watches.get(sessionId);
        if (watch != null) {
            watch.service.flush();
        }
    }

    /**
     * Wait for the next change message of the session, folding it into the change log.
     *
     * @return the message, or empty if none arrived within the timeout or the session is not watched
     */
    public Optional<ChangeBatch> awaitBatch(String sessionId, Duration timeout) throws InterruptedException {
        var watch = watches.get(sessionId);
        if (watch == null) {
            return Optional.empty();
        }
        var batch = watch.channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (batch == null) {
            return Optional.empty();
        }
        watch.record(batch);
        return Optional.of(batch);
    }

    /** Paths whose latest change happened within {@code since} of now. */
    public Set<Path> getRecentChanges(String sessionId, Duration since) {
        return getChangesSince(sessionId, clock.instant().minus(since));
    }

    /** Paths whose latest change happened at or after {@code since}, most recent first. */
    public Set<Path> getChangesSince(String sessionId, Instant since) {
        var paths = new LinkedHashSet<Path>();
        for (var record : getChangeRecords(sessionId, since)) {
            paths.add(record.filePath());
        }
        return paths;
    }

    /** One record per path, holding its latest timestamp, most recent first. */
    public List<ChangeRecord> getChangeRecords(String sessionId, Instant since) {
        var watch = watches.get(sessionId);
        if (watch == null) {
            return List.of();
        }
        var records = new ArrayList<ChangeRecord>();
        synchronized (watch) {
            watch.drain();
            watch.changeLog.forEach((path, at) -> {
                if (!at.isBefore(since)) {
                    records.add(new ChangeRecord(path, at));
                }
            });
        }
        records.sort(Comparator.comparing(ChangeRecord::timestamp)
                .reversed()
                .thenComparing(r -> r.filePath().toString()));
        return records;
    }

    /** True if the watcher reported lost events since watching started. */
    public boolean hasOverflowed(String sessionId) {
        var watch = watches.get(sessionId);
        if (watch == null) {
            return false;
        }
        synchronized (watch) {
            watch.drain();
            return watch.overflowed;
        }
    }

    private static void checkCancelled(String sessionId, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            logger.debug("Watch setup for session {} cancelled", sessionId);
            throw new CancellationException("Watch setup for session " + sessionId + " was cancelled");
        }
    }

    @Override
    public void close() {
        for (var sessionId : List.copyOf(watches.keySet())) {
            stopWatching(sessionId);
        }
    }
}
