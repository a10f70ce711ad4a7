package ai.reanalyze;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Watches one directory tree and reports debounced batches of changed files to its listeners.
 */
public interface IWatchService extends AutoCloseable {

    /**
     * Register the watch. Once this returns, every later change under the root is reported at least once.
     *
     * @throws IOException if the root cannot be watched
     */
    void start() throws IOException;

    boolean isRunning();

    /** Deliver buffered events now instead of waiting for the quiescence window to expire. */
    default void flush() {}

    void addListener(Listener listener);

    void removeListener(Listener listener);

    @Override
    void close();

    interface Listener {
        void onFilesChanged(EventBatch batch);
    }

    /** mutable while being accumulated; listeners receive a batch that is no longer written to */
    class EventBatch {
        boolean overflowed;
        final Map<Path, Instant> files = new LinkedHashMap<>();

        public EventBatch() {}

        /** Record an event, keeping only the most recent timestamp per path. */
        public void record(Path file, Instant at) {
            files.merge(file, at, (a, b) -> a.isAfter(b) ? a : b);
        }

        public void markOverflowed() {
            overflowed = true;
        }

        public boolean isOverflowed() {
            return overflowed;
        }

        /** Changed paths mapped to the time of their latest event. */
        public Map<Path, Instant> files() {
            return Collections.unmodifiableMap(files);
        }

        public boolean isEmpty() {
            return files.isEmpty() && !overflowed;
        }

        @Override
        public String toString() {
            return "EventBatch{" + "isOverflowed=" + overflowed + ", files=" + files.keySet() + '}';
        }
    }
}
