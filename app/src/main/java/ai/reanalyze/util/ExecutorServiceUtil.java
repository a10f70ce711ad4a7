package ai.reanalyze.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** Daemon threads named {@code prefix-N}; uncaught exceptions are logged instead of printed to stderr. */
    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> {
            var t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thr, ex) -> logger.error("Uncaught exception on thread {}", thr.getName(), ex));
            return t;
        };
    }

    public static ScheduledExecutorService newSingleThreadScheduler(String prefix) {
        return Executors.newSingleThreadScheduledExecutor(createNamedThreadFactory(prefix));
    }

    /** Shut down and wait briefly; interrupts stragglers. */
    public static void shutdownQuietly(ExecutorService executor, long timeoutMillis) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
