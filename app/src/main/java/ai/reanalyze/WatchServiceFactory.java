package ai.reanalyze;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Creates the {@link IWatchService} backing a session's change tracking. The default implementation is
 * {@link NativeWatchService}; tests substitute their own.
 */
@FunctionalInterface
public interface WatchServiceFactory {

    IWatchService create(Path root, List<String> patterns, IWatchService.Listener listener);

    static WatchServiceFactory nativeWatchers(Duration quiescence) {
        Logger logger = LogManager.getLogger(WatchServiceFactory.class);
        logger.info("Using native watch service with a {} ms quiescence window", quiescence.toMillis());
        return (root, patterns, listener) -> new NativeWatchService(root, patterns, quiescence, List.of(listener));
    }
}
