package ai.reanalyze;

import ai.reanalyze.cache.CompilationCacheService;
import ai.reanalyze.exception.InvalidSessionStateException;
import ai.reanalyze.exception.SessionNotFoundException;
import ai.reanalyze.exception.WatchSetupException;
import ai.reanalyze.exception.WorkspaceLoadException;
import ai.reanalyze.graph.DependencyGraph;
import ai.reanalyze.graph.DependencyGraphService;
import ai.reanalyze.sessions.OperationResult;
import ai.reanalyze.sessions.PauseChangesPreview;
import ai.reanalyze.sessions.PauseResult;
import ai.reanalyze.sessions.RefreshResult;
import ai.reanalyze.sessions.ResumeResult;
import ai.reanalyze.sessions.SessionRegistry;
import ai.reanalyze.sessions.SessionStartResult;
import ai.reanalyze.sessions.SessionState;
import ai.reanalyze.sessions.SessionSummary;
import ai.reanalyze.sessions.WorkspaceSession;
import ai.reanalyze.tools.ErrorPayload;
import ai.reanalyze.util.ExecutorServiceUtil;
import ai.reanalyze.workspace.UnitCompiler;
import ai.reanalyze.workspace.UnitId;
import ai.reanalyze.workspace.WorkspaceLoader;
import ai.reanalyze.workspace.WorkspaceSnapshot;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Drives session lifecycles: starting and ending sessions, pausing them while external tools edit the
 * workspace, and on resume invalidating exactly the cached units those edits can have affected.
 *
 * <p>Every operation on a session runs under that session's registry lock, validates first, and applies
 * the registry state transition as its last step, so a failure never leaves a session half paused or half
 * resumed.
 */
public class SessionOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionOrchestrator.class);

    private final SessionRegistry registry;
    private final DependencyGraphService graphService;
    private final CompilationCacheService cache;
    private final ChangeTracker changeTracker;
    private final WorkspaceLoader workspaceLoader;
    private final UnitCompiler compiler;
    private final List<String> watchPatterns;

    @Nullable
    private ScheduledExecutorService cleanupExecutor;

    private record ChangeImpact(
            List<Path> changedFiles, Set<UnitId> changedUnits, Set<UnitId> affectedUnits, List<Path> unmappedFiles) {}

    public SessionOrchestrator(
            SessionRegistry registry,
            DependencyGraphService graphService,
            CompilationCacheService cache,
            ChangeTracker changeTracker,
            WorkspaceLoader workspaceLoader,
            UnitCompiler compiler,
            List<String> watchPatterns) {
        this.registry = registry;
        this.graphService = graphService;
        this.cache = cache;
        this.changeTracker = changeTracker;
        this.workspaceLoader = workspaceLoader;
        this.compiler = compiler;
        this.watchPatterns = List.copyOf(watchPatterns);
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public CompilationCacheService getCache() {
        return cache;
    }

    // ---------------------------------------------------------------------------------------------
    // Session management
    // ---------------------------------------------------------------------------------------------

    /**
     * Load a workspace and open a session on it. With {@code prewarm}, the dependency graph is built and
     * leaf units are compiled right away; otherwise the graph is built on first request.
     */
    public OperationResult<SessionStartResult> startSession(Path source, boolean prewarm) {
        var snapshot = load(source);
        var session = registry.create(source, snapshot);
        var sessionId = session.getId();
        try {
            return registry.withSessionLock(sessionId, () -> {
                var warnings = new ArrayList<ErrorPayload>();
                int prewarmed = prewarm ? buildAndPrewarm(sessionId, snapshot, warnings) : 0;
                registry.activate(sessionId);
                var summary = session.toSummary(graphService.hasGraph(sessionId));
                return new OperationResult<>(new SessionStartResult(summary, prewarmed), warnings);
            });
        } catch (RuntimeException e) {
            logger.warn("Starting session {} for {} failed; discarding it", sessionId, source, e);
            discard(sessionId);
            throw e;
        }
    }

    public SessionSummary endSession(String sessionId) {
        return registry.withSessionLock(sessionId, () -> endLocked(sessionId));
    }

    /**
     * End the session only if it has not been accessed since {@code cutoff}. The access time is read
     * again under the session lock, so a session used after it was picked as idle survives.
     *
     * @return the summary of the ended session, or empty if it was in use
     */
    public Optional<SessionSummary> endSessionIfIdle(String sessionId, Instant cutoff) {
        return registry.withSessionLock(sessionId, () -> {
            var lastAccessed = registry.peek(sessionId).getLastAccessedAt();
            if (!lastAccessed.isBefore(cutoff)) {
                logger.debug("Session {} was used at {}; not idle any more", sessionId, lastAccessed);
                return Optional.<SessionSummary>empty();
            }
            return Optional.of(endLocked(sessionId));
        });
    }

    private SessionSummary endLocked(String sessionId) {
        changeTracker.stopWatching(sessionId);
        cache.clearSession(sessionId);
        graphService.invalidateGraph(sessionId);
        return registry.dispose(sessionId).toSummary(false);
    }

    /**
     * Reload the workspace from its source, swap in a freshly built graph and drop every cached artifact
     * of the session. Not allowed while paused: resume first so pending changes are accounted for.
     */
    public OperationResult<RefreshResult> refreshSession(String sessionId) {
        return registry.withSessionLock(sessionId, () -> {
            var session = registry.get(sessionId);
            if (session.getState() != SessionState.ACTIVE) {
                throw new InvalidSessionStateException(
                        sessionId, session.getState(), "only an active session can be refreshed; resume it first");
            }
            int previousUnits = session.getSnapshot().unitCount();
            var snapshot = load(session.getSource());

            registry.replaceSnapshot(sessionId, snapshot);
            var warnings = new ArrayList<ErrorPayload>();
            int invalidated = cache.invalidateAll(sessionId);
            int prewarmed = buildAndPrewarm(sessionId, snapshot, warnings);

            logger.info("Refreshed session {}: {} -> {} units, {} cache entries dropped",
                    sessionId, previousUnits, snapshot.unitCount(), invalidated);
            var result = new RefreshResult(session.toSummary(true), previousUnits, invalidated, prewarmed);
            return new OperationResult<>(result, warnings);
        });
    }

    public SessionSummary getSessionStatus(String sessionId) {
        return registry.get(sessionId).toSummary(graphService.hasGraph(sessionId));
    }

    public List<SessionSummary> listSessions() {
        return registry.list().stream()
                .map(s -> s.toSummary(graphService.hasGraph(s.getId())))
                .toList();
    }

    /** The session's dependency graph, built from its current snapshot on first request. */
    public DependencyGraph getOrBuildGraph(String sessionId) {
        var session = registry.get(sessionId);
        var existing = graphService.getGraph(sessionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        return registry.withSessionLock(
                sessionId, () -> graphService.getOrBuildGraph(sessionId, session.getSnapshot()));
    }

    // ---------------------------------------------------------------------------------------------
    // Pause / resume
    // ---------------------------------------------------------------------------------------------

    public OperationResult<PauseResult> pause(String sessionId, boolean watchFiles) {
        return pause(sessionId, watchFiles, () -> false);
    }

    /**
     * Pause an active session, optionally watching its root for changes. If the watch cannot be set up
     * the session is still paused, without watching, and a warning is returned. Cancellation is honored
     * up to the point the session is marked paused and leaves no trace.
     *
     * @throws CancellationException if {@code cancelled} reports true before the pause takes effect
     */
    public OperationResult<PauseResult> pause(String sessionId, boolean watchFiles, BooleanSupplier cancelled) {
        return registry.withSessionLock(sessionId, () -> {
            registry.checkCanPause(sessionId);
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Pause of session " + sessionId + " was cancelled");
            }
            var session = registry.get(sessionId);
            // taken before the watch starts, so every recorded change is at or after it
            var pausedAt = registry.now();

            var warnings = new ArrayList<ErrorPayload>();
            boolean watching = false;
            if (watchFiles) {
                try {
                    changeTracker.startWatching(sessionId, session.getSnapshot().root(), watchPatterns, cancelled);
                    watching = true;
                } catch (WatchSetupException e) {
                    warnings.add(new ErrorPayload(
                            ErrorPayload.Code.WATCH_SETUP_FAILED,
                            "File watching could not be started; changes made while paused will not be tracked",
                            e.getMessage()));
                }
            }

            registry.markPaused(sessionId, pausedAt, watching);
            var instruction = watching
                    ? "External changes will be tracked. Resume the session to rebuild only affected units."
                    : "Changes are not being tracked. Resume with forceFullRebuild=true after external edits.";
            return new OperationResult<>(new PauseResult(sessionId, true, watching, pausedAt, instruction), warnings);
        });
    }

    /**
     * Resume a paused session. Incrementally, the files changed since the pause are mapped to their units
     * and those units plus all their transitive dependents lose their cache entries. A forced resume, or
     * one where the watcher lost events, drops every entry of the session instead.
     */
    public OperationResult<ResumeResult> resume(String sessionId, boolean forceFullRebuild) {
        return registry.withSessionLock(sessionId, () -> {
            registry.checkCanResume(sessionId);
            var graph = graphService.requireGraph(sessionId);
            var session = registry.get(sessionId);
            var pausedAt = session.getPausedAt();

            var warnings = new ArrayList<ErrorPayload>();
            var impact = computeImpact(session, graph, warnings);
            boolean overflowed = changeTracker.hasOverflowed(sessionId);
            if (overflowed && !forceFullRebuild) {
                warnings.add(ErrorPayload.of(
                        ErrorPayload.Code.OVERFLOW,
                        "The file watcher lost events while paused; falling back to a full rebuild"));
            }

            boolean fullRebuild = forceFullRebuild || overflowed;
            Collection<UnitId> affected;
            int invalidated;
            if (fullRebuild) {
                affected = graph.unitIds();
                invalidated = cache.invalidateAll(sessionId);
            } else {
                affected = impact.affectedUnits();
                invalidated = 0;
                for (var unitId : affected) {
                    if (cache.invalidateUnit(sessionId, unitId)) {
                        invalidated++;
                    }
                }
            }

            changeTracker.stopWatching(sessionId);
            var now = registry.now();
            long pausedSeconds = pausedAt == null ? 0 : Duration.between(pausedAt, now).toSeconds();
            registry.markResumed(sessionId);

            int changedCount = impact.changedFiles().size();
            logger.info("Session {} resumed ({}): {} files changed, {} units affected, {} cache entries invalidated",
                    sessionId, fullRebuild ? "full rebuild" : "incremental", changedCount, affected.size(), invalidated);

            var result = new ResumeResult(
                    sessionId,
                    fullRebuild ? ResumeResult.FULL_REBUILD : ResumeResult.INCREMENTAL,
                    changedCount,
                    affected.size(),
                    limit(impact.changedFiles().stream().map(Path::toString).toList(), ResumeResult.LIST_LIMIT),
                    limit(affected.stream().map(UnitId::value).toList(), ResumeResult.LIST_LIMIT),
                    invalidated,
                    pausedSeconds,
                    new ResumeResult.RebuildStats(fullRebuild, !fullRebuild && changedCount > 0, !fullRebuild && changedCount == 0));
            return new OperationResult<>(result, warnings);
        });
    }

    /**
     * What resume would do right now, without doing it: the same changed files and affected units,
     * with no change to the tracker, the cache or the session.
     */
    public OperationResult<PauseChangesPreview> previewPauseChanges(String sessionId) {
        return registry.withSessionLock(sessionId, () -> {
            var session = registry.peek(sessionId);
            if (!session.isPaused()) {
                throw new InvalidSessionStateException(sessionId, session.getState(), "session is not paused");
            }
            var graph = graphService.requireGraph(sessionId);
            var warnings = new ArrayList<ErrorPayload>();
            var impact = computeImpact(session, graph, warnings);

            var pausedAt = session.getPausedAt();
            double minutes = pausedAt == null
                    ? 0
                    : Duration.between(pausedAt, registry.now()).toMillis() / 60_000.0;
            var changedFiles = impact.changedFiles().stream().map(Path::toString).toList();
            var affected = impact.affectedUnits().stream().map(UnitId::value).toList();

            var preview = new PauseChangesPreview(
                    sessionId,
                    true,
                    pausedAt,
                    Math.round(minutes * 100) / 100.0,
                    session.isWatchingFiles(),
                    new PauseChangesPreview.ChangedFiles(
                            changedFiles.size(), limit(changedFiles, PauseChangesPreview.FILE_LIMIT)),
                    new PauseChangesPreview.AffectedProjects(
                            affected.size(), limit(affected, PauseChangesPreview.PROJECT_LIMIT)),
                    PauseChangesPreview.Impact.forChangedFiles(changedFiles.size()));
            return new OperationResult<>(preview, warnings);
        });
    }

    // ---------------------------------------------------------------------------------------------
    // Idle cleanup
    // ---------------------------------------------------------------------------------------------

    /** End every session not accessed within {@code idleTimeout}. */
    public int cleanupIdleSessions(Duration idleTimeout) {
        var cutoff = registry.now().minus(idleTimeout);
        int ended = 0;
        for (var session : registry.findIdle(idleTimeout)) {
            try {
                var summary = endSessionIfIdle(session.getId(), cutoff);
                if (summary.isPresent()) {
                    ended++;
                    logger.info("Ended idle session {} (last accessed {})",
                            session.getId(), summary.get().lastAccessedAt());
                }
            } catch (SessionNotFoundException e) {
                logger.debug("Idle session {} was already ended", e.getSessionId());
            }
        }
        return ended;
    }

    public synchronized void startIdleCleanup(Duration idleTimeout, Duration interval) {
        if (cleanupExecutor != null) {
            return;
        }
        cleanupExecutor = ExecutorServiceUtil.newSingleThreadScheduler("SessionCleanup");
        cleanupExecutor.scheduleWithFixedDelay(
                () -> {
                    try {
                        cleanupIdleSessions(idleTimeout);
                    } catch (RuntimeException e) {
                        logger.error("Idle session cleanup failed", e);
                    }
                },
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        logger.info("Idle sessions are ended after {} minutes", idleTimeout.toMinutes());
    }

    @Override
    public synchronized void close() {
        if (cleanupExecutor != null) {
            ExecutorServiceUtil.shutdownQuietly(cleanupExecutor, 1000);
            cleanupExecutor = null;
        }
        changeTracker.close();
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    private WorkspaceSnapshot load(Path source) {
        try {
            return workspaceLoader.load(source);
        } catch (IOException | RuntimeException e) {
            throw new WorkspaceLoadException(source, e);
        }
    }

    private int buildAndPrewarm(String sessionId, WorkspaceSnapshot snapshot, List<ErrorPayload> warnings) {
        var graph = graphService.rebuildGraph(sessionId, snapshot);
        var prewarm = cache.prewarm(sessionId, graph, snapshot, compiler);
        if (!prewarm.failed().isEmpty()) {
            warnings.add(new ErrorPayload(
                    ErrorPayload.Code.PREWARM_FAILED,
                    prewarm.failed().size() + " leaf unit(s) could not be compiled ahead of time",
                    prewarm.failed().stream().map(UnitId::value).collect(Collectors.joining(", "))));
        }
        return prewarm.compiled();
    }

    private void discard(String sessionId) {
        try {
            registry.runWithSessionLock(sessionId, () -> {
                graphService.invalidateGraph(sessionId);
                cache.clearSession(sessionId);
                registry.dispose(sessionId);
            });
        } catch (SessionNotFoundException e) {
            logger.debug("Session {} already gone", sessionId);
        }
    }

    /*
     * Changed files since the pause, their owning units and the transitive impact. Files no unit owns are
     * skipped with a warning; the rest still count.
     */
    private ChangeImpact computeImpact(WorkspaceSession session, DependencyGraph graph, List<ErrorPayload> warnings) {
        var sessionId = session.getId();
        var pausedAt = session.getPausedAt();
        if (pausedAt == null || !changeTracker.isWatching(sessionId)) {
            return new ChangeImpact(List.of(), Set.of(), Set.of(), List.of());
        }

        changeTracker.flush(sessionId);
        var changed = changeTracker.getChangesSince(sessionId, pausedAt);
        var snapshot = session.getSnapshot();
        var changedUnits = new LinkedHashSet<UnitId>();
        var unmapped = new ArrayList<Path>();
        for (var file : changed) {
            var owners = snapshot.unitsContainingFile(file);
            if (owners.isEmpty()) {
                unmapped.add(file);
            } else {
                changedUnits.addAll(owners);
            }
        }

        if (!unmapped.isEmpty()) {
            logger.warn("{} of {} changed files in session {} belong to no compilation unit; skipping them",
                    unmapped.size(), changed.size(), sessionId);
            warnings.add(new ErrorPayload(
                    ErrorPayload.Code.PARTIAL_MAPPING,
                    unmapped.size() + " changed file(s) could not be mapped to a compilation unit",
                    limit(unmapped.stream().map(Path::toString).toList(), ResumeResult.LIST_LIMIT).toString()));
        }

        var affected = graph.getAffectedUnits(changedUnits);
        logger.debug("Session {}: {} changed files -> {} units -> {} affected",
                sessionId, changed.size(), changedUnits.size(), affected.size());
        return new ChangeImpact(List.copyOf(changed), changedUnits, affected, unmapped);
    }

    private static <T> List<T> limit(List<T> list, int max) {
        return list.size() <= max ? list : List.copyOf(list.subList(0, max));
    }
}
