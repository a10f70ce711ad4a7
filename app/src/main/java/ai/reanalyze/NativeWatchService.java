package ai.reanalyze;

import ai.reanalyze.util.ExecutorServiceUtil;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * File watching service using io.methvin:directory-watcher, which uses platform-native recursive
 * watching (FSEvents on macOS, inotify on Linux, FILE_TREE WatchService on Windows).
 *
 * <p>Events are accumulated and delivered to listeners once no new event has arrived for the quiescence
 * window, so an editor saving twenty files produces one batch rather than twenty callbacks.
 */
public class NativeWatchService implements IWatchService {
    private static final Logger logger = LogManager.getLogger(NativeWatchService.class);

    private final Path root;
    private final FileWatcherHelper helper;
    private final Duration quiescence;
    private final Clock clock;
    private final List<Listener> listeners;

    private final ScheduledExecutorService debounceExecutor;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private EventBatch accumulatedBatch = new EventBatch();

    @Nullable
    private ScheduledFuture<?> pendingFlush;

    @Nullable
    private volatile DirectoryWatcher watcher;

    @Nullable
    private volatile ExecutorService watcherExecutor;

    private volatile boolean running = false;

    public NativeWatchService(Path root, List<String> patterns, Duration quiescence, List<Listener> listeners) {
        this(root, patterns, quiescence, listeners, Clock.systemUTC());
    }

    NativeWatchService(Path root, List<String> patterns, Duration quiescence, List<Listener> listeners, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.helper = new FileWatcherHelper(this.root, patterns);
        this.quiescence = quiescence;
        this.clock = clock;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
        this.debounceExecutor = ExecutorServiceUtil.newSingleThreadScheduler("WatchDebounce");
    }

    @Override
    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "watch root is not a directory");
        }
        logger.debug("Setting up native directory watcher for {}", root);
        var newWatcher = DirectoryWatcher.builder()
                .path(root)
                .listener(this::handleEvent)
                .fileHashing(false)
                .build();
        var executor = Executors.newSingleThreadExecutor(ExecutorServiceUtil.createNamedThreadFactory("NativeDirectoryWatcher"));

        // watchAsync registers the tree before returning; the event loop then runs on the executor
        CompletableFuture<Void> loop;
        try {
            loop = newWatcher.watchAsync(executor);
        } catch (RuntimeException e) {
            closeQuietly(newWatcher, executor);
            throw new IOException("Failed to register watch on " + root, e);
        }
        if (loop.isCompletedExceptionally()) {
            closeQuietly(newWatcher, executor);
            try {
                loop.join();
            } catch (CompletionException e) {
                var cause = e.getCause() == null ? e : e.getCause();
                throw new IOException("Failed to register watch on " + root, cause);
            }
        }
        loop.whenComplete((unused, th) -> {
            if (th != null && running) {
                logger.error("Native directory watcher for {} stopped unexpectedly", root, th);
            }
        });

        watcher = newWatcher;
        watcherExecutor = executor;
        running = true;
        logger.info("Started native directory watcher for {} (quiescence {} ms)", root, quiescence.toMillis());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (!running) {
            return;
        }

        try {
            var eventType = event.eventType();
            lock.lock();
            try {
                if (eventType == DirectoryChangeEvent.EventType.OVERFLOW) {
                    logger.warn("Directory watcher overflow under {}; some events were lost", root);
                    accumulatedBatch.markOverflowed();
                } else {
                    var changedPath = event.path();
                    if (changedPath == null || event.isDirectory() || !helper.isRelevant(changedPath)) {
                        logger.trace("Skipping event {} on {}", eventType, changedPath);
                        return;
                    }
                    logger.trace("File event: {} on {}", eventType, changedPath);
                    accumulatedBatch.record(changedPath.toAbsolutePath().normalize(), clock.instant());
                }

                // every event restarts the quiescence window
                if (pendingFlush != null) {
                    pendingFlush.cancel(false);
                }
                pendingFlush = debounceExecutor.schedule(
                        this::flushAccumulatedEvents, quiescence.toMillis(), TimeUnit.MILLISECONDS);
            } finally {
                lock.unlock();
            }
        } catch (Exception e) {
            logger.error("Error handling directory change event", e);
        }
    }

    @Override
    public void flush() {
        flushAccumulatedEvents();
    }

    private void flushAccumulatedEvents() {
        lock.lock();
        try {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            if (accumulatedBatch.isEmpty()) {
                return;
            }

            var batchToNotify = accumulatedBatch;
            accumulatedBatch = new EventBatch();

            logger.debug("Flushing {} accumulated file events under {}", batchToNotify.files.size(), root);
            notifyFilesChanged(batchToNotify);
        } finally {
            lock.unlock();
        }
    }

    private void notifyFilesChanged(EventBatch batch) {
        for (Listener listener : listeners) {
            try {
                listener.onFilesChanged(batch);
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        boolean wasRunning = running;
        running = false;

        lock.lock();
        try {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            accumulatedBatch = new EventBatch();
        } finally {
            lock.unlock();
        }
        ExecutorServiceUtil.shutdownQuietly(debounceExecutor, 1000);

        var w = watcher;
        var executor = watcherExecutor;
        watcher = null;
        watcherExecutor = null;
        if (w != null && executor != null) {
            closeQuietly(w, executor);
        }
        if (wasRunning) {
            logger.info("Closed native directory watcher for {}", root);
        }
    }

    private void closeQuietly(DirectoryWatcher w, ExecutorService executor) {
        try {
            w.close();
        } catch (IOException e) {
            logger.warn("Error closing native directory watcher for {}", root, e);
        }
        ExecutorServiceUtil.shutdownQuietly(executor, 1000);
    }
}
