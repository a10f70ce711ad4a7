package ai.reanalyze;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * Message published on a session's change channel for each coalesced burst of file events.
 *
 * @param changes changed paths mapped to the time of their latest event
 * @param overflowed true if the watcher lost events during the burst, so the change set may be incomplete
 */
public record ChangeBatch(String sessionId, Map<Path, Instant> changes, boolean overflowed) {

    public enum Kind {
        SINGLE,
        BATCH
    }

    public ChangeBatch {
        changes = Map.copyOf(changes);
    }

    public Kind kind() {
        return changes.size() == 1 ? Kind.SINGLE : Kind.BATCH;
    }
}
