package ai.reanalyze.sessions;

import ai.reanalyze.workspace.WorkspaceSnapshot;
import java.nio.file.Path;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * A long-lived workspace session. Only {@link SessionRegistry} changes its fields; everything else reads
 * them. Fields are volatile so unlocked readers such as status queries see the latest committed state.
 */
public final class WorkspaceSession {
    private final String id;
    private final Path source;
    private final Instant createdAt;

    private volatile WorkspaceSnapshot snapshot;
    private volatile SessionState state = SessionState.CREATED;
    private volatile Instant lastAccessedAt;

    @Nullable
    private volatile Instant pausedAt;

    private volatile boolean watchingFiles;

    WorkspaceSession(String id, Path source, WorkspaceSnapshot snapshot, Instant createdAt) {
        this.id = id;
        this.source = source;
        this.snapshot = snapshot;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    /** Where the workspace was loaded from; refresh reloads from here. */
    public Path getSource() {
        return source;
    }

    public WorkspaceSnapshot getSnapshot() {
        return snapshot;
    }

    public SessionState getState() {
        return state;
    }

    public boolean isPaused() {
        return state == SessionState.PAUSED;
    }

    @Nullable
    public Instant getPausedAt() {
        return pausedAt;
    }

    public boolean isWatchingFiles() {
        return watchingFiles;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    void setSnapshot(WorkspaceSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    void setState(SessionState state) {
        this.state = state;
    }

    void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    void setPause(@Nullable Instant pausedAt, boolean watchingFiles) {
        this.pausedAt = pausedAt;
        this.watchingFiles = watchingFiles;
    }

    public SessionSummary toSummary(boolean graphBuilt) {
        return new SessionSummary(
                id,
                source,
                snapshot.root(),
                state,
                isPaused(),
                pausedAt,
                watchingFiles,
                createdAt,
                lastAccessedAt,
                snapshot.unitCount(),
                graphBuilt);
    }

    @Override
    public String toString() {
        return "WorkspaceSession{id=" + id + ", state=" + state + ", source=" + source + '}';
    }
}
