package ai.reanalyze.workspace;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of all compilation units of a workspace at one point in time.
 *
 * <p>Implementations must be safe to read from multiple threads. A snapshot never changes after it is
 * handed out; a refreshed workspace is represented by a new snapshot.
 */
public interface WorkspaceSnapshot {

    /** Root directory of the workspace, used as the watch root while a session is paused. */
    Path root();

    /** All units in enumeration order. The order is stable for the lifetime of the snapshot. */
    List<CompilationUnit> units();

    Instant loadedAt();

    /**
     * Resolve which unit(s) contain the given file. A file may belong to several units (linked sources),
     * or to none.
     */
    Set<UnitId> unitsContainingFile(Path file);

    default Optional<CompilationUnit> findUnit(UnitId id) {
        return units().stream().filter(u -> u.id().equals(id)).findFirst();
    }

    default int unitCount() {
        return units().size();
    }
}
